package smpc.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smpc.ComputationException;
import smpc.session.ComputationSession;
import smpc.session.SessionNotFoundException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stores each session as a JSON document named after its id. A document is written to a temporary file
 * and then moved over the previous one, so a reader never sees a partial session.
 */
public class FileComputationStore implements ComputationStore {
    private static final String EXTENSION = ".json";
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final Logger logger = LoggerFactory.getLogger("smpc");
    private final Path directory;
    private final Gson gson;

    /**
     * @param directory Directory holding the session documents; created if missing
     * @throws ComputationException If the directory cannot be created
     */
    public FileComputationStore(Path directory) throws ComputationException {
        this.directory = directory;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ComputationException("Failed to create session directory " + directory, e);
        }
        logger.info("Storing sessions in {}", directory.toAbsolutePath());
    }

    @Override
    public void save(ComputationSession session) throws ComputationException {
        Path target = pathOf(session.getId());
        Path temp = directory.resolve(session.getId() + EXTENSION + ".tmp");
        try {
            try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(SessionRecord.from(session), out);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ComputationException("Failed to save session " + session.getId(), e);
        }
    }

    @Override
    public ComputationSession load(String id) throws ComputationException {
        if (id == null || !VALID_ID.matcher(id).matches())
            throw new SessionNotFoundException("Unknown session " + id);
        try {
            return read(pathOf(id)).toSession();
        } catch (NoSuchFileException e) {
            throw new SessionNotFoundException("Unknown session " + id);
        } catch (IOException e) {
            throw new ComputationException("Failed to load session " + id, e);
        }
    }

    @Override
    public List<ComputationSession> list(SessionFilter filter) throws ComputationException {
        List<SessionRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files)
                records.add(read(file));
        } catch (IOException e) {
            throw new ComputationException("Failed to list sessions in " + directory, e);
        }
        records.sort(Comparator.comparingLong(SessionRecord::getCreatedAt));
        List<ComputationSession> sessions = new ArrayList<>(records.size());
        for (SessionRecord record : records) {
            ComputationSession session = record.toSession();
            if (filter.matches(session))
                sessions.add(session);
        }
        return sessions;
    }

    @Override
    public List<String> expireTerminalSessions(long maxAgeMillis) throws ComputationException {
        long cutoff = System.currentTimeMillis() - maxAgeMillis;
        List<String> removed = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                SessionRecord record = read(file);
                if (record.isTerminal() && record.getCompletedAt() < cutoff) {
                    Files.deleteIfExists(file);
                    removed.add(record.getId());
                }
            }
        } catch (IOException e) {
            throw new ComputationException("Failed to expire sessions in " + directory, e);
        }
        if (!removed.isEmpty())
            logger.info("Expired {} terminal sessions", removed.size());
        return removed;
    }

    private SessionRecord read(Path file) throws IOException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            SessionRecord record = gson.fromJson(new JsonReader(in), SessionRecord.class);
            if (record == null || record.getId() == null)
                throw new IOException("Empty session document " + file);
            return record;
        } catch (JsonParseException e) {
            throw new IOException("Malformed session document " + file, e);
        }
    }

    private Path pathOf(String id) {
        return directory.resolve(id + EXTENSION);
    }
}

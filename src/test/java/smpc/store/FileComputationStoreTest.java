package smpc.store;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import shamir.secretsharing.ShamirSecretSharing;
import smpc.aggregation.SecureAggregator;
import smpc.result.ComputationType;
import smpc.result.VarianceResult;
import smpc.session.ComputationSession;
import smpc.session.ParticipantContribution;
import smpc.session.SessionNotFoundException;
import smpc.session.SessionStatus;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/** Test of {@link FileComputationStore}. */
public final class FileComputationStoreTest {

    @TempDir
    Path directory;

    private ShamirSecretSharing scheme;

    @BeforeEach
    public void setUp() throws Exception {
        scheme = new ShamirSecretSharing();
    }

    /** A computed result is still there for a store opened after a restart. */
    @Test
    public void computedResultSurvivesRestart() throws Exception {
        ComputationSession session = ComputationSession.create(ComputationType.VARIANCE,
                Arrays.asList("org-a", "org-b", "org-c"), 2, "shamir-threshold/v1");
        submit(session, "org-a", "10.5");
        submit(session, "org-b", "20.75");
        submit(session, "org-c", "30.25");
        VarianceResult computed = (VarianceResult) session.compute(new SecureAggregator(scheme));
        new FileComputationStore(directory).save(session);

        ComputationSession loaded = new FileComputationStore(directory).load(session.getId());
        Assertions.assertThat(loaded.getStatus()).isEqualTo(SessionStatus.COMPUTED);
        Assertions.assertThat(loaded.getComputationResult()).isInstanceOf(VarianceResult.class);
        VarianceResult result = (VarianceResult) loaded.getComputationResult();
        Assertions.assertThat(result.getVariance()).isEqualByComparingTo(computed.getVariance());
        Assertions.assertThat(result.getMean()).isEqualByComparingTo(computed.getMean());
        Assertions.assertThat(result.getSecurityMethod()).isEqualTo("shamir-threshold/v1");
        Assertions.assertThat(result.getComputedAt()).isEqualTo(computed.getComputedAt());
        Assertions.assertThat(loaded.getCreatedAt()).isEqualTo(session.getCreatedAt());
    }

    /** Documents of terminal sessions keep who submitted but no shares or inputs. */
    @Test
    public void terminalDocumentHoldsNoShares() throws Exception {
        FileComputationStore store = new FileComputationStore(directory);
        ComputationSession session = ComputationSession.create(ComputationType.SUM,
                Arrays.asList("org-a", "org-b"), 2, "shamir-threshold/v1");
        submit(session, "org-a", "12.5");
        store.save(session);
        String collecting = new String(Files.readAllBytes(directory.resolve(session.getId() + ".json")),
                StandardCharsets.UTF_8);
        Assertions.assertThat(collecting).contains("partyIndex");

        submit(session, "org-b", "7.5");
        session.compute(new SecureAggregator(scheme));
        store.save(session);
        String computed = new String(Files.readAllBytes(directory.resolve(session.getId() + ".json")),
                StandardCharsets.UTF_8);
        Assertions.assertThat(computed).doesNotContain("partyIndex").doesNotContain("retainedInput");

        ComputationSession loaded = store.load(session.getId());
        Assertions.assertThat(loaded.getSubmittedCount()).isEqualTo(2);
        Assertions.assertThat(loaded.getContributions()).extracting(ParticipantContribution::getOrgId)
                .containsExactly("org-a", "org-b");
        Assertions.assertThat(loaded.getContributions())
                .allSatisfy(c -> Assertions.assertThat(c.getInputShares()).isEmpty());
        Assertions.assertThat(loaded.getComputationResult().getValue()).isEqualByComparingTo("20");
    }

    /** Shares and roster of a collecting session are preserved, so it can be computed after a reload. */
    @Test
    public void collectingSessionCanBeResumed() throws Exception {
        FileComputationStore store = new FileComputationStore(directory);
        ComputationSession session = ComputationSession.create(ComputationType.SUM,
                Arrays.asList("org-a", "org-b"), 2, "shamir-threshold/v1");
        submit(session, "org-a", "-1.25");
        store.save(session);

        ComputationSession resumed = store.load(session.getId());
        Assertions.assertThat(resumed.getStatus()).isEqualTo(SessionStatus.COLLECTING);
        Assertions.assertThat(resumed.getParticipatingOrgIds()).containsExactly("org-a", "org-b");
        submit(resumed, "org-b", "4");
        Assertions.assertThat(resumed.compute(new SecureAggregator(scheme)).getValue()).isEqualByComparingTo("2.75");
    }

    /** Listing filters by participating organization and keeps creation order. */
    @Test
    public void listFiltersByOrganization() throws Exception {
        FileComputationStore store = new FileComputationStore(directory);
        ComputationSession first = ComputationSession.create(ComputationType.SUM,
                Arrays.asList("org-a", "org-b"), 1, "shamir-threshold/v1");
        store.save(first);
        Thread.sleep(5);
        ComputationSession second = ComputationSession.create(ComputationType.MEAN,
                Arrays.asList("org-b", "org-c"), 1, "shamir-threshold/v1");
        store.save(second);

        List<ComputationSession> forB = store.list(SessionFilter.forOrg("org-b"));
        Assertions.assertThat(forB).extracting(ComputationSession::getId).containsExactly(first.getId(), second.getId());
        Assertions.assertThat(store.list(SessionFilter.forOrg("org-c"))).extracting(ComputationSession::getId)
                .containsExactly(second.getId());
        Assertions.assertThat(store.list(new SessionFilter(null, SessionStatus.COMPUTED))).isEmpty();
    }

    /** Unknown and malformed ids are reported as not found. */
    @Test
    public void unknownSessionIsNotFound() throws Exception {
        FileComputationStore store = new FileComputationStore(directory);
        Assertions.assertThatThrownBy(() -> store.load("missing")).isInstanceOf(SessionNotFoundException.class);
        Assertions.assertThatThrownBy(() -> store.load("../escape")).isInstanceOf(SessionNotFoundException.class);
    }

    /** Saving leaves no temporary files behind. */
    @Test
    public void saveReplacesDocumentAtomically() throws Exception {
        FileComputationStore store = new FileComputationStore(directory);
        ComputationSession session = ComputationSession.create(ComputationType.SUM,
                Arrays.asList("org-a", "org-b"), 2, "shamir-threshold/v1");
        store.save(session);
        submit(session, "org-a", "1");
        store.save(session);

        try (java.util.stream.Stream<Path> files = Files.list(directory)) {
            Assertions.assertThat(files).extracting(p -> p.getFileName().toString())
                    .containsExactly(session.getId() + ".json");
        }
        Assertions.assertThat(store.load(session.getId()).getSubmittedCount()).isEqualTo(1);
    }

    /** Expiry deletes the documents of old terminal sessions only. */
    @Test
    public void expiresTerminalSessions() throws Exception {
        FileComputationStore store = new FileComputationStore(directory);
        ComputationSession open = ComputationSession.create(ComputationType.SUM,
                Arrays.asList("org-a", "org-b"), 2, "shamir-threshold/v1");
        ComputationSession aborted = ComputationSession.create(ComputationType.SUM,
                Arrays.asList("org-a", "org-b"), 2, "shamir-threshold/v1");
        aborted.fail("Aborted", "timeout");
        store.save(open);
        store.save(aborted);
        Thread.sleep(5);

        Assertions.assertThat(store.expireTerminalSessions(60_000)).isEmpty();
        Assertions.assertThat(store.expireTerminalSessions(0)).containsExactly(aborted.getId());
        Assertions.assertThat(Files.exists(directory.resolve(aborted.getId() + ".json"))).isFalse();
        Assertions.assertThatThrownBy(() -> store.load(aborted.getId())).isInstanceOf(SessionNotFoundException.class);
        Assertions.assertThat(store.load(open.getId()).getStatus()).isEqualTo(SessionStatus.PENDING);
    }

    private void submit(ComputationSession session, String orgId, String value) throws Exception {
        session.submitShare(ParticipantContribution.share(orgId, new BigDecimal(value), scheme,
                session.getParticipatingOrgIds().size(), session.getThreshold()));
    }
}

package smpc.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smpc.Configuration;
import smpc.engine.ComputationEngine;
import smpc.result.ComputationResult;
import smpc.result.ComputationType;
import smpc.session.SessionSummary;
import smpc.store.FileComputationStore;

import java.math.BigDecimal;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * Runs sum, mean and variance sessions for three hospitals over a sample metric.
 * Usage: HealthMetricsDemo [configuration file]
 */
public class HealthMetricsDemo {
    private static final Logger logger = LoggerFactory.getLogger("demo");

    public static void main(String[] args) throws Exception {
        if (args.length > 0)
            Configuration.setConfigurationFilePath(args[0]);
        Configuration configuration = Configuration.getInstance();
        ComputationEngine engine = new ComputationEngine(
                new FileComputationStore(Paths.get(configuration.getStoreDirectory())), configuration);

        List<String> hospitals = Arrays.asList("hospital-a", "hospital-b", "hospital-c");
        String[] averageStayDays = {"10.5", "20.75", "30.25"};

        for (ComputationType type : ComputationType.values()) {
            String sessionId = engine.create(type, hospitals, 2);
            for (int i = 0; i < hospitals.size(); i++)
                engine.submit(sessionId, hospitals.get(i), new BigDecimal(averageStayDays[i]));
            ComputationResult result = engine.compute(sessionId);
            logger.info("{} = {} ({})", type, result.getValue().toPlainString(), result.getSecurityMethod());
        }

        for (SessionSummary summary : engine.list("hospital-a"))
            logger.info("{}", summary);
    }
}

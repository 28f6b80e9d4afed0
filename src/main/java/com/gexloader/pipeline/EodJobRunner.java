package com.gexloader.pipeline;

import com.gexloader.config.OratsConfig;
import com.gexloader.domain.model.RunResult;
import com.gexloader.exception.BaseException;
import com.gexloader.exception.ErrorCode;
import com.gexloader.exception.MissingTokenException;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command surface of the loader. Runs {@link EodSnapshotJob} once after startup and
 * reports the process exit code.
 *
 * <pre>
 * --date=YYYY-MM-DD         stored-date override
 * --source-date=YYYY-MM-DD  source-date override
 * --token=...               API token override
 * </pre>
 *
 * <p>Exit codes come from {@link ErrorCode}; 0 covers both a written partition and a
 * run that found nothing new to write.
 */
@Component
public class EodJobRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(EodJobRunner.class);

    static final String OPT_STORED_DATE = "date";
    static final String OPT_SOURCE_DATE = "source-date";
    static final String OPT_TOKEN = "token";

    private final EodSnapshotJob eodSnapshotJob;
    private final OratsConfig oratsConfig;

    private volatile int exitCode;

    public EodJobRunner(EodSnapshotJob eodSnapshotJob, OratsConfig oratsConfig) {
        this.eodSnapshotJob = eodSnapshotJob;
        this.oratsConfig = oratsConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        try {
            String tokenOverride = option(args, OPT_TOKEN);
            if (tokenOverride != null) {
                oratsConfig.setToken(tokenOverride);
            }
            if (!oratsConfig.hasToken()) {
                throw new MissingTokenException();
            }
            log.info("Using ORATS token {}", oratsConfig.maskedToken());

            LocalDate storedDate = dateOption(args, OPT_STORED_DATE);
            LocalDate sourceDate = dateOption(args, OPT_SOURCE_DATE);
            RunResult result = eodSnapshotJob.run(storedDate, sourceDate);
            log.info("Run outcome {} for {} {}", result.getOutcome(), result.getTicker(), result.getStoredDate());
            return 0;
        } catch (BaseException e) {
            log.error("{}: {} {}", e.getErrorCode().getCode(), e.getMessage(), e.getDetails());
            return e.getErrorCode().getExitCode();
        } catch (RuntimeException e) {
            log.error("Unhandled failure: {}", e.getMessage(), e);
            return ErrorCode.INTERNAL_ERROR.getExitCode();
        }
    }

    private static LocalDate dateOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        return value != null ? LocalDate.parse(value) : null;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }
}

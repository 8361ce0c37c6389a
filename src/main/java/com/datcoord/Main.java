package com.datcoord;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datcoord.audit.AuditVerification;
import com.datcoord.audit.ContributionAuditLog;
import com.datcoord.coordinator.CoordinationContext;
import com.datcoord.coordinator.Coordinator;
import com.datcoord.coordinator.CoordinatorStateStore;
import com.datcoord.core.CoordinationException;
import com.datcoord.core.Identity;
import com.datcoord.runtime.AppConfig;
import com.datcoord.session.OptimizerKind;
import com.datcoord.session.TrainingConfig;
import com.datcoord.store.ContentId;
import com.datcoord.store.ContentStore;
import com.datcoord.store.ContentStoreException;
import com.datcoord.store.ContentStores;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "dat-coordinator",
        mixinStandardHelpOptions = true,
        version = "dat-coordinator 0.1.0",
        description = "Coordinates training sessions, gradient submissions and model version finalization.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_COORDINATION = 3;
    static final int EXIT_STORAGE = 4;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--state-path", description = "Overrides coordinator.statePath from the config")
    Path statePath;

    @Option(names = "--mode", required = true, converter = ModeConverter.class,
            description = "One of: create-model, advance-version, model, latest, versions, start, begin, pause, resume, "
                    + "stop, epoch, fail, status, sessions, submit, pending, finalize, aggregate, register, award, "
                    + "contributor, leaderboard, put-blob, verify-audit")
    Mode mode;

    @Option(names = "--caller", description = "Identity performing the call")
    String caller;

    @Option(names = "--lineage", description = "Model lineage id")
    String lineage;

    @Option(names = "--model-version", description = "Model version number")
    Long modelVersion;

    @Option(names = "--session", description = "Training session id")
    String sessionId;

    @Option(names = "--gradient-ref", description = "Content id of an already stored gradient")
    String gradientRef;

    @Option(names = "--weights-ref", description = "Content id of model weights")
    String weightsRef;

    @Option(names = "--dataset-ref", description = "Content id of the training dataset")
    String datasetRef;

    @Option(names = "--file", description = "Local file to store as a blob (put-blob, submit)")
    Path file;

    @Option(names = "--epochs", description = "Training epochs for start mode")
    Integer epochs;

    @Option(names = "--batch-size", description = "Batch size for start mode")
    Integer batchSize;

    @Option(names = "--learning-rate", description = "Learning rate for start mode")
    Double learningRate;

    @Option(names = "--optimizer", description = "Optimizer for start mode (adam, sgd, rmsprop, adagrad)")
    String optimizer;

    @Option(names = "--validation-split", description = "Validation split for start mode")
    Double validationSplit;

    @Option(names = "--aggregation-threshold", description = "Pending gradients that make a version due for aggregation")
    Integer aggregationThreshold;

    @Option(names = "--loss", description = "Loss reported by epoch mode")
    Double loss;

    @Option(names = "--accuracy", description = "Accuracy reported by epoch mode")
    Double accuracy;

    @Option(names = "--reason", description = "Failure reason for fail mode")
    String reason;

    @Option(names = "--identity", description = "Contributor identity (register, award, contributor)")
    String identity;

    @Option(names = "--amount", description = "Reputation amount for award mode")
    Long amount;

    @Option(names = "--limit", description = "Leaderboard size", defaultValue = "10")
    int limit;

    private final PrintStream out;
    private final ObjectMapper jsonMapper = JsonMapper.builder().findAndAddModules().build();

    public Main() {
        this(System.out);
    }

    Main(PrintStream out) {
        this.out = out;
    }

    enum Mode {
        CREATE_MODEL("create-model", true),
        ADVANCE_VERSION("advance-version", true),
        MODEL("model", false),
        LATEST("latest", false),
        VERSIONS("versions", false),
        START("start", true),
        BEGIN("begin", true),
        PAUSE("pause", true),
        RESUME("resume", true),
        STOP("stop", true),
        EPOCH("epoch", true),
        FAIL("fail", true),
        STATUS("status", false),
        SESSIONS("sessions", false),
        SUBMIT("submit", true),
        PENDING("pending", false),
        FINALIZE("finalize", true),
        AGGREGATE("aggregate", true),
        REGISTER("register", true),
        AWARD("award", true),
        CONTRIBUTOR("contributor", false),
        LEADERBOARD("leaderboard", false),
        PUT_BLOB("put-blob", false),
        VERIFY_AUDIT("verify-audit", false);

        private final String cliName;
        private final boolean mutating;

        Mode(String cliName, boolean mutating) {
            this.cliName = cliName;
            this.mutating = mutating;
        }

        static Mode fromCli(String value) {
            for (Mode candidate : values()) {
                if (candidate.cliName.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                    return candidate;
                }
            }
            throw new IllegalArgumentException("unknown mode: " + value);
        }
    }

    public static class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            try {
                return Mode.fromCli(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        Path resolvedState = statePath != null ? statePath : Path.of(config.getCoordinator().getStatePath());
        log.debug("Using config file: {} state: {}", configPath, resolvedState);

        if (mode == Mode.VERIFY_AUDIT) {
            AuditVerification verification = ContributionAuditLog.verify(Path.of(config.getCoordinator().getAuditLogPath()));
            print(verification);
            return verification.intact() ? EXIT_OK : EXIT_COORDINATION;
        }

        ContentStore contentStore = ContentStores.fromConfig(config.getContentStore());
        CoordinatorStateStore stateStore = new CoordinatorStateStore(resolvedState);
        Coordinator coordinator = new Coordinator(CoordinationContext.create(config.getCoordinator(), contentStore));
        coordinator.restore(stateStore.load());
        log.info("cli.run mode={} contentStore={}", mode.cliName, contentStore.describe());

        try {
            Object result = execute(coordinator);
            print(result);
            return EXIT_OK;
        } catch (UsageException e) {
            log.error(e.getMessage());
            return EXIT_USAGE;
        } catch (CoordinationException e) {
            log.error("cli.rejected mode={} code={} message={}", mode.cliName, e.getCode(), e.getMessage());
            return EXIT_COORDINATION;
        } catch (ContentStoreException e) {
            log.error("cli.storage mode={} retryable={} message={}", mode.cliName, e.isRetryable(), e.getMessage());
            return EXIT_STORAGE;
        } finally {
            if (mode.mutating) {
                stateStore.save(coordinator.snapshot());
            }
        }
    }

    private Object execute(Coordinator coordinator) throws IOException {
        switch (mode) {
            case CREATE_MODEL:
                return coordinator.createModel(require(lineage, "--lineage"),
                        ContentId.of(require(weightsRef, "--weights-ref")), callerIdentity());
            case ADVANCE_VERSION:
                return coordinator.advanceVersion(require(lineage, "--lineage"), callerIdentity());
            case MODEL:
                return coordinator.getModelVersion(require(modelVersion, "--model-version"));
            case LATEST:
                return coordinator.latestModelVersion(require(lineage, "--lineage"));
            case VERSIONS:
                return coordinator.listModelVersions(require(lineage, "--lineage"));
            case START:
                String started = coordinator.startSession(require(lineage, "--lineage"), trainingConfig());
                return coordinator.sessionStatus(started);
            case BEGIN:
                return coordinator.beginSession(require(sessionId, "--session"),
                        datasetRef == null ? null : ContentId.of(datasetRef));
            case PAUSE:
                return coordinator.pauseSession(require(sessionId, "--session"));
            case RESUME:
                return coordinator.resumeSession(require(sessionId, "--session"));
            case STOP:
                return coordinator.stopSession(require(sessionId, "--session"));
            case EPOCH:
                return coordinator.advanceEpoch(require(sessionId, "--session"),
                        require(loss, "--loss"), require(accuracy, "--accuracy"));
            case FAIL:
                return coordinator.failSession(require(sessionId, "--session"), reason);
            case STATUS:
                return coordinator.sessionStatus(require(sessionId, "--session"));
            case SESSIONS:
                return coordinator.listSessions(lineage);
            case SUBMIT:
                return submit(coordinator);
            case PENDING:
                long pendingVersion = require(modelVersion, "--model-version");
                Map<String, Object> pending = new LinkedHashMap<>();
                pending.put("modelVersion", pendingVersion);
                pending.put("pending", coordinator.listPending(pendingVersion));
                pending.put("aggregationDue", coordinator.aggregationDue(pendingVersion));
                return pending;
            case FINALIZE:
                return coordinator.finalize(require(modelVersion, "--model-version"),
                        ContentId.of(require(weightsRef, "--weights-ref")), callerIdentity());
            case AGGREGATE:
                return coordinator.aggregate(require(modelVersion, "--model-version"), callerIdentity());
            case REGISTER:
                return coordinator.registerContributor(Identity.of(require(identity, "--identity")));
            case AWARD:
                return coordinator.awardReputation(callerIdentity(),
                        Identity.of(require(identity, "--identity")), require(amount, "--amount"));
            case CONTRIBUTOR:
                Identity looked = Identity.of(require(identity, "--identity"));
                return coordinator.contributor(looked)
                        .<Object>map(found -> found)
                        .orElseGet(() -> Map.of("identity", looked.value(), "registered", false));
            case LEADERBOARD:
                return coordinator.leaderboard(limit);
            case PUT_BLOB:
                ContentId stored = coordinator.storeBlob(Files.readAllBytes(require(file, "--file")));
                return Map.of("contentId", stored);
            default:
                throw new UsageException("unsupported mode " + mode.cliName);
        }
    }

    private Map<String, Object> submit(Coordinator coordinator) throws IOException {
        long version = require(modelVersion, "--model-version");
        Identity contributor = callerIdentity();
        Map<String, Object> result = new LinkedHashMap<>();
        if (file != null) {
            result.put("result", coordinator.submitGradientBlob(contributor, version, Files.readAllBytes(file)));
        } else {
            result.put("result", coordinator.submitGradient(contributor, version,
                    ContentId.of(require(gradientRef, "--gradient-ref or --file"))));
        }
        result.put("pendingCount", coordinator.listPending(version).size());
        result.put("aggregationDue", coordinator.aggregationDue(version));
        return result;
    }

    private TrainingConfig trainingConfig() {
        TrainingConfig defaults = TrainingConfig.defaults();
        return new TrainingConfig(
                epochs != null ? epochs : defaults.epochs(),
                batchSize != null ? batchSize : defaults.batchSize(),
                learningRate != null ? learningRate : defaults.learningRate(),
                optimizer != null ? OptimizerKind.fromName(optimizer) : defaults.optimizer(),
                validationSplit != null ? validationSplit : defaults.validationSplit(),
                datasetRef != null ? ContentId.of(datasetRef) : null,
                aggregationThreshold != null ? aggregationThreshold : defaults.aggregationThreshold());
    }

    private Identity callerIdentity() {
        return Identity.of(require(caller, "--caller"));
    }

    private <T> T require(T value, String option) {
        if (value == null || (value instanceof String && ((String) value).isBlank())) {
            throw new UsageException(option + " is required in " + mode.cliName.toLowerCase(Locale.ROOT) + " mode");
        }
        return value;
    }

    private void print(Object result) throws IOException {
        out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        out.flush();
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}

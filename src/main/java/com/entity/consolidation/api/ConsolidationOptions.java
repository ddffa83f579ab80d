package com.entity.consolidation.api;

import com.entity.consolidation.core.model.EntityType;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.rules.DefaultNameVariants;
import com.entity.consolidation.rules.NameVariants;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Options for a consolidation run.
 * Configures the database, the entity type, the enabled passes and where the audit goes.
 */
public class ConsolidationOptions {

    public static final String ENV_DB_PATH = "ENTITY_DB_PATH";
    public static final String ENV_AUDIT_PATH = "CONSOLIDATION_AUDIT_PATH";
    public static final String ENV_BACKUP_DIR = "CONSOLIDATION_BACKUP_DIR";

    private static final String DEFAULT_AUDIT_PATH = "entity_consolidation_audit.json";
    private static final String DEFAULT_BACKUP_DIR = "backups";
    private static final int DEFAULT_CHECKPOINT_INTERVAL = 100;
    private static final int DEFAULT_TYPO_WINDOW_SIZE = 20;
    private static final String DEFAULT_AUDIT_USER = "entity-consolidation";

    private final Path dbPath;
    private final EntityType entityType;
    private final boolean dryRun;
    private final Path auditPath;
    private final Path backupDir;
    private final boolean backupEnabled;
    private final Set<MatchMethod> enabledMethods;
    private final boolean auditTable;
    private final String auditUserId;
    private final int checkpointInterval;
    private final int typoWindowSize;
    private final NameVariants nameVariants;
    private final Path knownAliasesPath;

    private ConsolidationOptions(Builder builder) {
        this.dbPath = builder.dbPath;
        this.entityType = builder.entityType;
        this.dryRun = builder.dryRun;
        this.auditPath = builder.auditPath;
        this.backupDir = builder.backupDir;
        this.backupEnabled = builder.backupEnabled;
        this.enabledMethods = Collections.unmodifiableSet(EnumSet.copyOf(builder.enabledMethods));
        this.auditTable = builder.auditTable;
        this.auditUserId = builder.auditUserId;
        this.checkpointInterval = builder.checkpointInterval;
        this.typoWindowSize = builder.typoWindowSize;
        this.nameVariants = builder.nameVariants;
        this.knownAliasesPath = builder.knownAliasesPath;
    }

    public Path getDbPath() {
        return dbPath;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Path getAuditPath() {
        return auditPath;
    }

    public Path getBackupDir() {
        return backupDir;
    }

    public boolean isBackupEnabled() {
        return backupEnabled;
    }

    public Set<MatchMethod> getEnabledMethods() {
        return enabledMethods;
    }

    public boolean isAuditTable() {
        return auditTable;
    }

    public String getAuditUserId() {
        return auditUserId;
    }

    public int getCheckpointInterval() {
        return checkpointInterval;
    }

    public int getTypoWindowSize() {
        return typoWindowSize;
    }

    public NameVariants getNameVariants() {
        return nameVariants;
    }

    /**
     * JSON file of canonical names and their known variants, or {@code null} when none is configured.
     */
    public Path getKnownAliasesPath() {
        return knownAliasesPath;
    }

    /**
     * Creates default options for the given database.
     */
    public static ConsolidationOptions defaults(Path dbPath) {
        return builder().dbPath(dbPath).build();
    }

    /**
     * Reads options from command-line arguments, falling back to environment variables.
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a missing database path
     */
    public static ConsolidationOptions fromArgs(String[] args, Map<String, String> env) {
        Builder builder = builder();
        String db = env.get(ENV_DB_PATH);
        if (env.get(ENV_AUDIT_PATH) != null) {
            builder.auditPath(Path.of(env.get(ENV_AUDIT_PATH)));
        }
        if (env.get(ENV_BACKUP_DIR) != null) {
            builder.backupDir(Path.of(env.get(ENV_BACKUP_DIR)));
        }

        boolean passesGiven = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--db" -> db = value(args, ++i, arg);
                case "--type" -> builder.entityType(parseType(value(args, ++i, arg)));
                case "--dry-run" -> builder.dryRun(true);
                case "--audit" -> builder.auditPath(Path.of(value(args, ++i, arg)));
                case "--backup-dir" -> builder.backupDir(Path.of(value(args, ++i, arg)));
                case "--no-backup" -> builder.backupEnabled(false);
                case "--passes" -> {
                    builder.enabledMethods(parsePasses(value(args, ++i, arg)));
                    passesGiven = true;
                }
                case "--aliases" -> builder.knownAliasesPath(Path.of(value(args, ++i, arg)));
                case "--audit-table" -> builder.auditTable(true);
                case "--checkpoint" -> builder.checkpointInterval(parseInt(value(args, ++i, arg), arg));
                case "--typo-window" -> builder.typoWindowSize(parseInt(value(args, ++i, arg), arg));
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }

        if (db == null || db.isBlank()) {
            throw new IllegalArgumentException("Database path is required (--db or " + ENV_DB_PATH + ")");
        }
        // an alias file on top of the default passes turns the alias pass on
        if (builder.knownAliasesPath != null && !passesGiven) {
            Set<MatchMethod> methods = EnumSet.copyOf(builder.enabledMethods);
            methods.add(MatchMethod.KNOWN_ALIAS);
            builder.enabledMethods(methods);
        }
        return builder.dbPath(Path.of(db)).build();
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static int parseInt(String value, String flag) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + flag + ": " + value);
        }
    }

    private static EntityType parseType(String value) {
        EntityType type = EntityType.fromLabel(value);
        if (type == EntityType.UNKNOWN && !value.equalsIgnoreCase(EntityType.UNKNOWN.getLabel())) {
            throw new IllegalArgumentException("Unknown entity type: " + value);
        }
        return type;
    }

    private static Set<MatchMethod> parsePasses(String value) {
        Set<MatchMethod> methods = EnumSet.noneOf(MatchMethod.class);
        for (String name : value.split(",")) {
            if (!name.isBlank()) {
                methods.add(MatchMethod.fromPassName(name.trim()));
            }
        }
        return methods;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path dbPath;
        private EntityType entityType = EntityType.PERSON;
        private boolean dryRun = false;
        private Path auditPath = Path.of(DEFAULT_AUDIT_PATH);
        private Path backupDir = Path.of(DEFAULT_BACKUP_DIR);
        private boolean backupEnabled = true;
        private Set<MatchMethod> enabledMethods = EnumSet.of(
                MatchMethod.EXACT_MATCH, MatchMethod.NAME_REORDERING, MatchMethod.TYPO_CORRECTION);
        private boolean auditTable = false;
        private String auditUserId = DEFAULT_AUDIT_USER;
        private int checkpointInterval = DEFAULT_CHECKPOINT_INTERVAL;
        private int typoWindowSize = DEFAULT_TYPO_WINDOW_SIZE;
        private NameVariants nameVariants;
        private Path knownAliasesPath;

        public Builder dbPath(Path dbPath) {
            this.dbPath = Objects.requireNonNull(dbPath, "dbPath");
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = Objects.requireNonNull(entityType, "entityType");
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder auditPath(Path auditPath) {
            this.auditPath = Objects.requireNonNull(auditPath, "auditPath");
            return this;
        }

        public Builder backupDir(Path backupDir) {
            this.backupDir = Objects.requireNonNull(backupDir, "backupDir");
            return this;
        }

        public Builder backupEnabled(boolean backupEnabled) {
            this.backupEnabled = backupEnabled;
            return this;
        }

        public Builder enabledMethods(Set<MatchMethod> enabledMethods) {
            if (enabledMethods == null || enabledMethods.isEmpty()) {
                throw new IllegalArgumentException("At least one pass must be enabled");
            }
            this.enabledMethods = EnumSet.copyOf(enabledMethods);
            return this;
        }

        public Builder auditTable(boolean auditTable) {
            this.auditTable = auditTable;
            return this;
        }

        public Builder auditUserId(String auditUserId) {
            this.auditUserId = Objects.requireNonNull(auditUserId, "auditUserId");
            return this;
        }

        public Builder checkpointInterval(int checkpointInterval) {
            if (checkpointInterval < 0) {
                throw new IllegalArgumentException("checkpointInterval must be >= 0, got: " + checkpointInterval);
            }
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public Builder typoWindowSize(int typoWindowSize) {
            if (typoWindowSize < 1) {
                throw new IllegalArgumentException("typoWindowSize must be >= 1, got: " + typoWindowSize);
            }
            this.typoWindowSize = typoWindowSize;
            return this;
        }

        public Builder nameVariants(NameVariants nameVariants) {
            this.nameVariants = Objects.requireNonNull(nameVariants, "nameVariants");
            return this;
        }

        public Builder knownAliasesPath(Path knownAliasesPath) {
            this.knownAliasesPath = Objects.requireNonNull(knownAliasesPath, "knownAliasesPath");
            return this;
        }

        public ConsolidationOptions build() {
            Objects.requireNonNull(dbPath, "dbPath is required");
            if (enabledMethods.contains(MatchMethod.KNOWN_ALIAS) && knownAliasesPath == null) {
                throw new IllegalArgumentException("The known alias pass needs an alias file (--aliases)");
            }
            if (nameVariants == null) {
                nameVariants = DefaultNameVariants.create();
            }
            return new ConsolidationOptions(this);
        }
    }
}

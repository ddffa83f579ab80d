package com.entity.consolidation.api;

import com.entity.consolidation.core.model.EntityType;
import com.entity.consolidation.core.model.MatchMethod;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConsolidationOptions.
 */
class ConsolidationOptionsTest {

    @Test
    void defaults() {
        ConsolidationOptions options = ConsolidationOptions.defaults(Path.of("archive.db"));

        assertEquals(EntityType.PERSON, options.getEntityType());
        assertFalse(options.isDryRun());
        assertEquals(Path.of("entity_consolidation_audit.json"), options.getAuditPath());
        assertEquals(Path.of("backups"), options.getBackupDir());
        assertTrue(options.isBackupEnabled());
        assertEquals(EnumSet.of(MatchMethod.EXACT_MATCH, MatchMethod.NAME_REORDERING, MatchMethod.TYPO_CORRECTION),
                options.getEnabledMethods());
        assertFalse(options.isAuditTable());
        assertEquals(100, options.getCheckpointInterval());
        assertEquals(20, options.getTypoWindowSize());
        assertNotNull(options.getNameVariants());
    }

    @Test
    void parsesArguments() {
        ConsolidationOptions options = ConsolidationOptions.fromArgs(new String[]{
                "--db", "data/archive.db", "--type", "organization", "--dry-run",
                "--audit", "out/audit.json", "--backup-dir", "bk", "--passes", "exact, prefix,nickname",
                "--audit-table", "--checkpoint", "10", "--no-backup", "--typo-window", "5"}, Map.of());

        assertEquals(Path.of("data/archive.db"), options.getDbPath());
        assertEquals(EntityType.ORGANIZATION, options.getEntityType());
        assertTrue(options.isDryRun());
        assertEquals(Path.of("out/audit.json"), options.getAuditPath());
        assertEquals(Path.of("bk"), options.getBackupDir());
        assertEquals(Set.of(MatchMethod.EXACT_MATCH, MatchMethod.PREFIX_STRIPPING, MatchMethod.NICKNAME_RESOLUTION),
                options.getEnabledMethods());
        assertTrue(options.isAuditTable());
        assertEquals(10, options.getCheckpointInterval());
        assertFalse(options.isBackupEnabled());
        assertEquals(5, options.getTypoWindowSize());
    }

    @Test
    void environmentProvidesFallbacks() {
        ConsolidationOptions options = ConsolidationOptions.fromArgs(new String[0], Map.of(
                ConsolidationOptions.ENV_DB_PATH, "/srv/archive.db",
                ConsolidationOptions.ENV_AUDIT_PATH, "/srv/audit.json",
                ConsolidationOptions.ENV_BACKUP_DIR, "/srv/backups"));

        assertEquals(Path.of("/srv/archive.db"), options.getDbPath());
        assertEquals(Path.of("/srv/audit.json"), options.getAuditPath());
        assertEquals(Path.of("/srv/backups"), options.getBackupDir());
    }

    @Test
    void argumentsOverrideEnvironment() {
        ConsolidationOptions options = ConsolidationOptions.fromArgs(
                new String[]{"--db", "cli.db"}, Map.of(ConsolidationOptions.ENV_DB_PATH, "env.db"));

        assertEquals(Path.of("cli.db"), options.getDbPath());
    }

    @Test
    void aliasFileEnablesKnownAliasPass() {
        ConsolidationOptions options = ConsolidationOptions.fromArgs(
                new String[]{"--db", "a.db", "--aliases", "conf/aliases.json"}, Map.of());

        assertEquals(Path.of("conf/aliases.json"), options.getKnownAliasesPath());
        assertEquals(EnumSet.of(MatchMethod.KNOWN_ALIAS, MatchMethod.EXACT_MATCH,
                MatchMethod.NAME_REORDERING, MatchMethod.TYPO_CORRECTION), options.getEnabledMethods());
    }

    @Test
    void explicitPassesWinOverAliasDefault() {
        ConsolidationOptions options = ConsolidationOptions.fromArgs(
                new String[]{"--passes", "exact", "--db", "a.db", "--aliases", "aliases.json"}, Map.of());

        assertEquals(EnumSet.of(MatchMethod.EXACT_MATCH), options.getEnabledMethods());
        assertEquals(Path.of("aliases.json"), options.getKnownAliasesPath());
    }

    @Test
    void knownAliasPassNeedsAliasFile() {
        Map<String, String> env = Map.of();
        assertThrows(IllegalArgumentException.class,
                () -> ConsolidationOptions.fromArgs(new String[]{"--db", "a.db", "--passes", "known,exact"}, env));
        assertThrows(IllegalArgumentException.class,
                () -> ConsolidationOptions.fromArgs(new String[]{"--db", "a.db", "--aliases"}, env));
        assertNull(ConsolidationOptions.defaults(Path.of("a.db")).getKnownAliasesPath());
    }

    @Test
    void usageErrors() {
        Map<String, String> env = Map.of();
        assertThrows(IllegalArgumentException.class, () -> ConsolidationOptions.fromArgs(new String[0], env));
        assertThrows(IllegalArgumentException.class,
                () -> ConsolidationOptions.fromArgs(new String[]{"--db"}, env));
        assertThrows(IllegalArgumentException.class,
                () -> ConsolidationOptions.fromArgs(new String[]{"--db", "a.db", "--bogus"}, env));
        assertThrows(IllegalArgumentException.class,
                () -> ConsolidationOptions.fromArgs(new String[]{"--db", "a.db", "--type", "Planet"}, env));
        assertThrows(IllegalArgumentException.class,
                () -> ConsolidationOptions.fromArgs(new String[]{"--db", "a.db", "--checkpoint", "ten"}, env));
        assertThrows(IllegalArgumentException.class,
                () -> ConsolidationOptions.fromArgs(new String[]{"--db", "a.db", "--passes", "soundex"}, env));
        assertThrows(IllegalArgumentException.class,
                () -> ConsolidationOptions.fromArgs(new String[]{"--db", "a.db", "--passes", ","}, env));
    }

    @Test
    void builderValidation() {
        assertThrows(IllegalArgumentException.class, () -> ConsolidationOptions.builder().checkpointInterval(-1));
        assertThrows(IllegalArgumentException.class, () -> ConsolidationOptions.builder().typoWindowSize(0));
        assertThrows(NullPointerException.class, () -> ConsolidationOptions.builder().build());
    }
}

package warden.core.model.session;

/**
 * Snapshot of the session vault.
 *
 * @param vaultId                 identifier of this vault instance
 * @param threadCount             number of live records
 * @param oldestThreadAgeMinutes  minutes since the least recently accessed record
 *                                was touched, or null when the vault is empty
 */
public record VaultStatus(String vaultId, int threadCount, Long oldestThreadAgeMinutes) {}

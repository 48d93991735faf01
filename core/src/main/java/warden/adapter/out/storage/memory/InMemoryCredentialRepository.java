package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;

import warden.core.model.credential.Credential;
import warden.core.port.out.CredentialRepository;

/**
 * In-memory implementation of CredentialRepository.
 *
 * <p>Data is NOT persisted across restarts and is not shared between nodes.
 * Suitable for development, testing and single-instance deployments.
 *
 * <p>This class is instantiated by {@link InMemoryCredentialStorageProvider}.
 *
 * <p>Thread-safety: the per-subject index entry is the unit of atomicity.
 * Inserts run inside {@link ConcurrentHashMap#compute} on the owner's index
 * entry, so the active-credential count and the insert cannot interleave with
 * another insert for the same subject.
 */
public class InMemoryCredentialRepository implements CredentialRepository {

    private final ConcurrentHashMap<String, Credential> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> idByHash = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> idsByUser = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> insertIfBelowLimit(Credential credential, int maxActive, Instant now) {
        return Uni.createFrom().item(() -> {
            final var inserted = new AtomicBoolean(false);
            idsByUser.compute(credential.userId(), (userId, ids) -> {
                final var owned = ids != null ? ids : ConcurrentHashMap.<String>newKeySet();
                final var active = owned.stream()
                        .map(storageById::get)
                        .filter(existing -> existing != null && existing.isUsableAt(now))
                        .count();
                if (active >= maxActive) {
                    return ids;
                }
                storageById.put(credential.id(), credential);
                idByHash.put(credential.keyHash(), credential.id());
                owned.add(credential.id());
                inserted.set(true);
                return owned;
            });
            return inserted.get();
        });
    }

    @Override
    public Uni<Optional<Credential>> findByHash(String keyHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(idByHash.get(keyHash)).map(storageById::get));
    }

    @Override
    public Uni<Optional<Credential>> findById(String credentialId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(credentialId)));
    }

    @Override
    public Uni<List<Credential>> findByUserId(String userId) {
        return Uni.createFrom().item(() -> {
            final var ids = idsByUser.getOrDefault(userId, Set.of());
            final var result = new ArrayList<Credential>(ids.size());
            for (final var id : ids) {
                final var credential = storageById.get(id);
                if (credential != null) {
                    result.add(credential);
                }
            }
            return result;
        });
    }

    @Override
    public Uni<Boolean> recordUsage(String credentialId, Instant usedAt) {
        return Uni.createFrom()
                .item(() -> storageById.computeIfPresent(credentialId, (id, existing) -> existing.recordUse(usedAt))
                        != null);
    }

    @Override
    public Uni<Optional<Credential>> deactivate(String credentialId) {
        return Uni.createFrom().item(() -> {
            final var previous = new Credential[1];
            storageById.computeIfPresent(credentialId, (id, existing) -> {
                previous[0] = existing;
                return existing.active() ? existing.revoke() : existing;
            });
            return Optional.ofNullable(previous[0]);
        });
    }

    @Override
    public Uni<Integer> deleteExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (final var credential : List.copyOf(storageById.values())) {
                if (credential.isExpiredAt(now) && remove(credential)) {
                    removed++;
                }
            }
            return removed;
        });
    }

    private boolean remove(Credential credential) {
        final var removed = new AtomicBoolean(false);
        idsByUser.computeIfPresent(credential.userId(), (userId, ids) -> {
            if (storageById.remove(credential.id()) != null) {
                idByHash.remove(credential.keyHash());
                ids.remove(credential.id());
                removed.set(true);
            }
            return ids.isEmpty() ? null : ids;
        });
        return removed.get();
    }
}

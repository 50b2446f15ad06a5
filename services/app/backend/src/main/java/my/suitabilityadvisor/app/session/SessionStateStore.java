package my.suitabilityadvisor.app.session;

import java.util.Optional;

/**
 * Persistence for the single session snapshot. Implementations may throw
 * {@link SessionStoreException}; callers treat persistence as best effort.
 */
public interface SessionStateStore {
	void save(SessionSnapshot snapshot);

	Optional<SessionSnapshot> load();

	void clear();
}

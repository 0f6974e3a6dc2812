package io.mnemo.core.goal;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface GoalStore {
    Goal create(NewGoal goal) throws IOException;

    Goal get(long id) throws IOException;

    Optional<Goal> find(long id) throws IOException;

    /**
     * @throws io.mnemo.core.store.NotFoundException when no goal has this id; nothing is written
     */
    Goal update(long id, GoalUpdate update) throws IOException;

    /** A null status lists every goal. */
    List<Goal> list(GoalStatus status) throws IOException;

    Optional<Goal> findActiveByTitle(String title) throws IOException;
}

package io.recur4j;

import java.util.List;

public interface CrewDirectory {

    /**
     * Ids of the employees currently on the crew.
     */
    List<String> activeMemberIds(String crewId);

    static CrewDirectory none() {
        return crewId -> List.of();
    }
}

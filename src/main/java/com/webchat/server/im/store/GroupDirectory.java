package com.webchat.server.im.store;

import java.util.List;

public interface GroupDirectory {

    /**
     * User ids of every member of the group, empty if the group is unknown.
     */
    List<Long> getGroupMembers(long groupId);
}

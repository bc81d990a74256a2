package com.deepansh.toolplanner.model;

/**
 * Why one tool call has to wait for another.
 */
public enum DependencyType {

    /** No ordering constraint */
    NONE,

    /** Both calls touch the same or an overlapping resource and at least one of them writes it */
    RESOURCE,

    /** The earlier call changes ambient state (directories, services, repo state) the later call may rely on */
    ORDER,

    /** The later call's arguments reference the earlier call's id */
    DATA
}

package com.wagerdesk.common.data;

/**
 * A team or player resolved from a free-text name.
 *
 * @param teamId  for players, the team they play for; for teams, their own id
 */
public record EntityRef(String entityId, String name, EntityKind kind, String teamId) {

    public enum EntityKind {
        TEAM,
        PLAYER
    }
}

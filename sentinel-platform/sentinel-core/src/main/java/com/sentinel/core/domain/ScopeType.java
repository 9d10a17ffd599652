package com.sentinel.core.domain;

/**
 * Where a piece of content lives. Strikes and restrictions are keyed by the scope id,
 * the scope type only describes what that id refers to.
 */
public enum ScopeType {
    STREAM,
    POST,
    STORY,
    MESSAGE,
    PROFILE
}

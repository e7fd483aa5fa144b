package com.questrail.fixture.api;

/**
 * ServiceState
 * -----------------------------------------------------------------------------
 * Lifecycle states of a socket-backed fixture.
 *
 * <pre>
 *   CONSTRUCTED ──start()──▶ STARTED ──stop()──▶ STOPPED
 *        │                                          ▲
 *        └──────────────────stop()──────────────────┘
 * </pre>
 *
 * {@link #STOPPED} is terminal. A fresh instance is required to serve again.
 */
public enum ServiceState
{
    /** Resources reserved, not serving yet. */
    CONSTRUCTED,

    /** Background worker running. */
    STARTED,

    /** Terminal. */
    STOPPED
}

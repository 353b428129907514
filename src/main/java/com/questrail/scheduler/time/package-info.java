/**
 * Time sources.
 *
 * <p>Every due-time decision uses a {@link com.questrail.scheduler.time.MonotonicClock}.
 * {@link com.questrail.scheduler.time.WallClock} values appear only in
 * observability events.</p>
 */
package com.questrail.scheduler.time;

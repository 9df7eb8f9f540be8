package com.bastion.gateway.session;

import com.bastion.security.session.SessionCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Sweeps sessions that outlived their TTL but were never looked up again.
 */
@Component
public class SessionEvictionTask {

    private static final Logger log = LoggerFactory.getLogger(SessionEvictionTask.class);

    private final SessionCache sessions;

    public SessionEvictionTask(SessionCache sessions) {
        this.sessions = sessions;
    }

    @Scheduled(fixedDelayString = "${bastion.auth.eviction-interval:PT5M}",
            initialDelayString = "${bastion.auth.eviction-interval:PT5M}")
    public void evictExpired() {
        int evicted = sessions.evictExpired();
        if (evicted > 0) {
            log.info("Evicted {} expired sessions, {} remain", evicted, sessions.size());
        }
    }
}

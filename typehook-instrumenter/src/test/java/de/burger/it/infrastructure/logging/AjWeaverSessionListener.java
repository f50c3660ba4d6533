package de.burger.it.infrastructure.logging;

import org.junit.platform.launcher.LauncherSession;
import org.junit.platform.launcher.LauncherSessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Installs load-time weaving once per launcher session, before any engine class is loaded. */
public class AjWeaverSessionListener implements LauncherSessionListener {
    private static final Logger log = LoggerFactory.getLogger(AjWeaverSessionListener.class);

    @Override
    public void launcherSessionOpened(LauncherSession session) {
        AjWeaverBootstrap.ensureInstalled();
        if (AjWeaverBootstrap.isInstalled()) {
            log.debug("Engine call logging woven for this test session");
        } else {
            log.info("Self-attach unavailable; engine tests run without woven call logging");
        }
    }

    @Override
    public void launcherSessionClosed(LauncherSession session) {
        MDC.remove("cid");
    }
}

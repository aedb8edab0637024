package net.cadence.core.event;

import net.cadence.core.spi.NotificationTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 기본 전송: 실제 전달 없이 로그만 남긴다 */
public final class LoggingNotificationTransport implements NotificationTransport {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationTransport.class);

    @Override
    public void send(Notification notification) {
        log.info("Would notify {}: {}", notification.address(), notification.subject());
    }
}

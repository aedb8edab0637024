package net.cadence.core.spi;

import net.cadence.core.event.Notification;

/** 이메일/Slack 등 실제 전달은 외부 협력자 몫 */
public interface NotificationTransport {
    void send(Notification notification) throws Exception;
}

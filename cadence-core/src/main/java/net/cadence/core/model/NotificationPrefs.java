package net.cadence.core.model;

public record NotificationPrefs(String address, boolean notifyOnSuccess, boolean notifyOnFailure) {

    public static NotificationPrefs none() { return new NotificationPrefs(null, false, true); }

    public boolean hasAddress() { return address != null && !address.isBlank(); }

    /** 최종 결과 기준으로 알림 대상인지 */
    public boolean wants(boolean success) {
        return hasAddress() && (success ? notifyOnSuccess : notifyOnFailure);
    }
}

package com.costguard.anomaly.notification;

public interface AnomalyNotifier {

    String name();

    boolean isEnabled();

    void send(AlertMessage message);
}

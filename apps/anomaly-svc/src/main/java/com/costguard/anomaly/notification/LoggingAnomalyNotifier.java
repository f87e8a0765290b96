package com.costguard.anomaly.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAnomalyNotifier implements AnomalyNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAnomalyNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void send(AlertMessage message) {
        log.info("anomaly_alert subject=\"{}\"\n{}", message.subject(), message.body());
    }
}

package com.costguard.anomaly.notification;

public record AlertMessage(String subject, String body) {
}

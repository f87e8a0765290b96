package com.costguard.anomaly.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

public class SnsAnomalyNotifier implements AnomalyNotifier {

    private static final Logger log = LoggerFactory.getLogger(SnsAnomalyNotifier.class);
    // SNS rejects subjects longer than 100 characters
    static final int MAX_SUBJECT_LENGTH = 100;

    private final SnsClient client;
    private final String topicArn;

    public SnsAnomalyNotifier(SnsClient client, String topicArn) {
        if (topicArn == null || topicArn.isBlank()) {
            throw new IllegalArgumentException("topicArn must be provided");
        }
        this.client = client;
        this.topicArn = topicArn;
    }

    @Override
    public String name() {
        return "sns";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void send(AlertMessage message) {
        String subject = message.subject().length() > MAX_SUBJECT_LENGTH
                ? message.subject().substring(0, MAX_SUBJECT_LENGTH)
                : message.subject();
        PublishResponse response = client.publish(PublishRequest.builder()
                .topicArn(topicArn)
                .subject(subject)
                .message(message.body())
                .build());
        log.info("anomaly_alert channel=sns topicArn={} messageId={}", topicArn, response.messageId());
    }
}

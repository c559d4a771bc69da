package com.eyelevel.contentmoderation.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

@Configuration
public class SqsListenerConfig {

    /**
     * Container factory for the moderation worker: one message in flight, deleted only after the
     * listener returns normally.
     * <p>
     * The container does not start with the context. The
     * {@link com.eyelevel.contentmoderation.service.queue.WorkerContainerController} starts it once the
     * queue is reachable and stops it again while the connection is lost.
     */
    @Bean("moderationContainerFactory")
    public SqsMessageListenerContainerFactory<Object> moderationContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                                 ModerationProperties properties) {

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);

        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                                            .maxConcurrentMessages(1)
                                            .maxMessagesPerPoll(1)
                                            .autoStartup(false)
                                            .pollTimeout(Duration.ofSeconds(
                                                    properties.getQueue().getPollTimeoutSeconds())));
        return factory;
    }
}

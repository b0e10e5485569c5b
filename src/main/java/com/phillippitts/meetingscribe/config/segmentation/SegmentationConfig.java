package com.phillippitts.meetingscribe.config.segmentation;

import com.phillippitts.meetingscribe.config.properties.RecognitionGatewayProperties;
import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.config.properties.StreamProperties;
import com.phillippitts.meetingscribe.config.properties.VadGatewayProperties;
import com.phillippitts.meetingscribe.service.gateway.EnergyVadGateway;
import com.phillippitts.meetingscribe.service.gateway.HttpRecognitionGateway;
import com.phillippitts.meetingscribe.service.gateway.RecognitionGateway;
import com.phillippitts.meetingscribe.service.gateway.VadGateway;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetrics;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetricsPublisher;
import com.phillippitts.meetingscribe.service.output.EventPublishingTranscriptSink;
import com.phillippitts.meetingscribe.service.output.TranscriptSink;
import com.phillippitts.meetingscribe.service.stream.AudioStreamFactory;
import com.phillippitts.meetingscribe.service.stream.SegmentationEngine;
import com.phillippitts.meetingscribe.service.stream.StreamRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the segmentation engine. The core classes are plain Java; this is the only place
 * that knows about Spring. Gateways and the sink back off when the application defines
 * its own.
 */
@Configuration
public class SegmentationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public VadGateway vadGateway(VadGatewayProperties properties,
                                 @Qualifier("gatewayExecutor") Executor gatewayExecutor) {
        return new EnergyVadGateway(properties, gatewayExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecognitionGateway recognitionGateway(RecognitionGatewayProperties properties,
                                                 @Qualifier("gatewayExecutor") Executor gatewayExecutor) {
        return new HttpRecognitionGateway(properties, gatewayExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public TranscriptSink transcriptSink(ApplicationEventPublisher publisher, Clock clock) {
        return new EventPublishingTranscriptSink(publisher, clock);
    }

    @Bean
    public AudioStreamFactory audioStreamFactory(SegmentationProperties segmentation,
                                                 StreamProperties streams,
                                                 VadGateway vadGateway,
                                                 RecognitionGateway recognitionGateway,
                                                 TranscriptSink sink,
                                                 SegmentationMetricsPublisher metrics,
                                                 Clock clock,
                                                 @Qualifier("streamExecutor") Executor streamExecutor) {
        return new AudioStreamFactory(segmentation, streams, vadGateway, recognitionGateway, sink,
                metrics, clock, streamExecutor);
    }

    @Bean
    public StreamRegistry streamRegistry(AudioStreamFactory factory, SegmentationMetrics metrics) {
        StreamRegistry registry = new StreamRegistry(factory);
        metrics.bindActiveStreams(registry::size);
        return registry;
    }

    @Bean(destroyMethod = "endSession")
    public SegmentationEngine segmentationEngine(StreamRegistry registry,
                                                 StreamProperties streams,
                                                 SegmentationProperties segmentation,
                                                 SegmentationMetricsPublisher metrics) {
        return new SegmentationEngine(registry, streams, segmentation, metrics);
    }
}

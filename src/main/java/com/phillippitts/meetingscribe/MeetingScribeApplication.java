package com.phillippitts.meetingscribe;

import com.phillippitts.meetingscribe.config.properties.RecognitionGatewayProperties;
import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.config.properties.StreamProperties;
import com.phillippitts.meetingscribe.config.properties.VadGatewayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SegmentationProperties.class,
        StreamProperties.class,
        VadGatewayProperties.class,
        RecognitionGatewayProperties.class
})
@EnableScheduling
public class MeetingScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetingScribeApplication.class, args);
    }

}

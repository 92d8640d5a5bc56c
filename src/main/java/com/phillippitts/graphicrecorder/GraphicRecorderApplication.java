package com.phillippitts.graphicrecorder;

import com.phillippitts.graphicrecorder.config.properties.AnalysisProperties;
import com.phillippitts.graphicrecorder.config.properties.AudioUploadProperties;
import com.phillippitts.graphicrecorder.config.properties.ContextProperties;
import com.phillippitts.graphicrecorder.config.properties.ImageModelProperties;
import com.phillippitts.graphicrecorder.config.properties.PendingAudioProperties;
import com.phillippitts.graphicrecorder.config.properties.ReconnectProperties;
import com.phillippitts.graphicrecorder.config.properties.ReportProperties;
import com.phillippitts.graphicrecorder.config.properties.ThreadPoolProperties;
import com.phillippitts.graphicrecorder.config.properties.WebSocketProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AnalysisProperties.class,
        AudioUploadProperties.class,
        ContextProperties.class,
        ImageModelProperties.class,
        PendingAudioProperties.class,
        ReconnectProperties.class,
        ReportProperties.class,
        ThreadPoolProperties.class,
        WebSocketProperties.class
})
public class GraphicRecorderApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphicRecorderApplication.class, args);
    }

}

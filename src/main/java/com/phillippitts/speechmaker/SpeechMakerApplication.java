package com.phillippitts.speechmaker;

import com.phillippitts.speechmaker.config.properties.ConversionProperties;
import com.phillippitts.speechmaker.config.properties.ConverterProperties;
import com.phillippitts.speechmaker.config.properties.DiagnosticsProperties;
import com.phillippitts.speechmaker.config.properties.ReadinessProperties;
import com.phillippitts.speechmaker.config.properties.RetryProperties;
import com.phillippitts.speechmaker.config.properties.VoiceEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ConversionProperties.class,
        ConverterProperties.class,
        DiagnosticsProperties.class,
        ReadinessProperties.class,
        RetryProperties.class,
        VoiceEngineProperties.class
})
@EnableScheduling
public class SpeechMakerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeechMakerApplication.class, args);
    }

}

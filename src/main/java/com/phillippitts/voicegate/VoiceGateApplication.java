package com.phillippitts.voicegate;

import com.phillippitts.voicegate.config.properties.ConversationLogProperties;
import com.phillippitts.voicegate.config.properties.JanitorProperties;
import com.phillippitts.voicegate.config.properties.PricingProperties;
import com.phillippitts.voicegate.config.properties.ProviderProperties;
import com.phillippitts.voicegate.config.properties.UsageLimitProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        UsageLimitProperties.class,
        JanitorProperties.class,
        ConversationLogProperties.class,
        ProviderProperties.class,
        PricingProperties.class
})
@EnableScheduling
public class VoiceGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceGateApplication.class, args);
    }

}

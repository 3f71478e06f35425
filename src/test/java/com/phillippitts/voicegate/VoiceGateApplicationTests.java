package com.phillippitts.voicegate;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@Tag("integration")
@SpringBootTest(properties = "voice.janitor.enabled=false")
class VoiceGateApplicationTests {

    @Test
    void contextLoads() {
    }

}

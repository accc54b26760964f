package com.lrucache.demo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lrucache.json.CacheSnapshotWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(OutputCaptureExtension.class)
public class CacheDemoRunnerTest {

    @Test
    void testDemoLogsEachStep(CapturedOutput output) {
        new CacheDemoRunner(new CacheSnapshotWriter(new ObjectMapper())).run();

        String log = output.getOut();
        assertTrue(log.contains("adam:29 < john:26 < angela:24 < bob:48"));
        assertTrue(log.contains("adam:29 < john:26 < bob:48 < angela:24"));
        assertTrue(log.contains("Evicted adam:29"));
        assertTrue(log.contains("john:26 < bob:48 < angela:24 < ygwie:81"));
        assertTrue(log.contains("adam still cached: false"));
        assertTrue(log.contains("bob:48 < angela:24 < ygwie:81 < john:11"));
    }
}

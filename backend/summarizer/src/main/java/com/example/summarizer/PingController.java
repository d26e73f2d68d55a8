package com.example.summarizer;

import com.example.summarizer.config.Settings;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class PingController {
    private final Settings settings;

    @GetMapping("/ping")
    public Map<String, Object> pong() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ping", "pong!");
        body.put("environment", settings.environment());
        body.put("testing", settings.testing());
        return body;
    }
}

package com.tasktracker.guard.classifier;

import com.tasktracker.guard.model.DeviceInfo;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UserAgentParserTest {

    private final UserAgentParser parser = new UserAgentParser();

    @Test
    void parse_windowsChrome() {
        DeviceInfo info = parser.parse(
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36");
        assertThat(info.deviceType()).isEqualTo("Desktop");
        assertThat(info.browser()).isEqualTo("Chrome");
        assertThat(info.operatingSystem()).isEqualTo("Windows");
        assertThat(info.label()).isEqualTo("Desktop - Chrome");
    }

    @Test
    void parse_androidChrome_reportsLinux() {
        DeviceInfo info = parser.parse(
                "Mozilla/5.0 (Linux; Android 14) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Mobile Safari/537.36");
        assertThat(info.deviceType()).isEqualTo("Mobile");
        assertThat(info.browser()).isEqualTo("Chrome");
        assertThat(info.operatingSystem()).isEqualTo("Linux");
    }

    @Test
    void parse_iPad_isTablet() {
        DeviceInfo info = parser.parse("Mozilla/5.0 (iPad; CPU OS 17_0 like Mac OS X) Version/17.0 Safari/605.1.15");
        assertThat(info.deviceType()).isEqualTo("Tablet");
        assertThat(info.browser()).isEqualTo("Safari");
        assertThat(info.operatingSystem()).isEqualTo("macOS");
    }

    @Test
    void parse_firefoxOnLinux() {
        DeviceInfo info = parser.parse("Mozilla/5.0 (X11; Linux x86_64; rv:125.0) Gecko/20100101 Firefox/125.0");
        assertThat(info.browser()).isEqualTo("Firefox");
        assertThat(info.operatingSystem()).isEqualTo("Linux");
    }

    @Test
    void parse_missingAgent_isUnknownDesktop() {
        assertThat(parser.parse(null)).isEqualTo(new DeviceInfo("Desktop", "Unknown", "Unknown"));
        assertThat(parser.parse("  ")).isEqualTo(new DeviceInfo("Desktop", "Unknown", "Unknown"));
    }

    @Test
    void parse_unrecognisedAgent() {
        DeviceInfo info = parser.parse("curl/8.4.0");
        assertThat(info.deviceType()).isEqualTo("Desktop");
        assertThat(info.browser()).isEqualTo("Unknown");
        assertThat(info.operatingSystem()).isEqualTo("Unknown");
    }
}

package com.heronix.attendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

import com.heronix.attendance.config.AttendanceProperties;

/**
 * Heronix Attendance - Session Authorization and Attendance Analytics
 *
 * Decides when a teacher may open an attendance capture session for a class,
 * persists the submitted roster, and refreshes each student's subject standing
 * (trend, consistency, attentiveness, risk) in the background.
 */
@SpringBootApplication
@EnableConfigurationProperties(AttendanceProperties.class)
@EnableAsync
public class AttendanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttendanceApplication.class, args);
    }
}

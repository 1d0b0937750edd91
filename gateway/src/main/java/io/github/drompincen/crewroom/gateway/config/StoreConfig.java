package io.github.drompincen.crewroom.gateway.config;

import io.github.drompincen.crewroom.persistence.repository.FileRoomRepository;
import io.github.drompincen.crewroom.persistence.repository.FileWorkLogRepository;
import io.github.drompincen.crewroom.persistence.repository.RoomRepository;
import io.github.drompincen.crewroom.persistence.repository.WorkLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    RoomRepository roomRepository(@Value("${crewroom.data-dir:${user.home}/.crewroom}") String dataDir) {
        Path roomsDir = Path.of(dataDir).resolve("rooms");
        log.info("Room records stored under {}", roomsDir.toAbsolutePath());
        return new FileRoomRepository(roomsDir);
    }

    @Bean
    WorkLogRepository workLogRepository(@Value("${crewroom.data-dir:${user.home}/.crewroom}") String dataDir) {
        Path logsDir = Path.of(dataDir).resolve("worklogs");
        log.info("Sealed work logs stored under {}", logsDir.toAbsolutePath());
        return new FileWorkLogRepository(logsDir);
    }
}

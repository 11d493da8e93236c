package com.rebenew.stageParty.syncserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StageSyncServerApplication {
	private static final Logger logger = LoggerFactory.getLogger(StageSyncServerApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(StageSyncServerApplication.class, args);
		logger.info("🎤 Stage sync server started, WebSocket at /rooms/ws");
	}
}

package com.baykanat.killboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Uygulama giriş noktası; JobScheduler ve JobProcessor ApplicationReadyEvent ile başlar. */
@SpringBootApplication
public class KillboardApplication {

	public static void main(String[] args) {
		SpringApplication.run(KillboardApplication.class, args);
	}

}

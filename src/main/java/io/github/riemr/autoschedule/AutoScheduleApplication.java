package io.github.riemr.autoschedule;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@MapperScan("io.github.riemr.autoschedule.infrastructure.mapper")
public class AutoScheduleApplication {

	public static void main(String[] args) {
		SpringApplication.run(AutoScheduleApplication.class, args);
	}

}

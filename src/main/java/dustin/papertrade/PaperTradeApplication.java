package dustin.papertrade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableKafka
@EnableScheduling
@EnableRetry
public class PaperTradeApplication {

	public static void main(String[] args) {
		SpringApplication.run(PaperTradeApplication.class, args);
	}

}

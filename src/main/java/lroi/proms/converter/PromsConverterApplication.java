package lroi.proms.converter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PromsConverterApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(PromsConverterApplication.class, args)));
	}

}

package github.sarthakdev143.hdr_merge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HdrMergeApplication {

	public static void main(String[] args) {
		SpringApplication.run(HdrMergeApplication.class, args);
	}

}

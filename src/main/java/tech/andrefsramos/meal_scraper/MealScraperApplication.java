package tech.andrefsramos.meal_scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MealScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(MealScraperApplication.class, args);
    }
}

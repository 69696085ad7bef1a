package tech.andrefsramos.meal_scraper.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Meal Scraper - campus cafeteria menus",
                version = "v1",
                description = """
                                ---

                                ## 🎯 Overview

                                The **Meal Scraper** API collects the menus published by campus cafeterias
                                (HTML menu pages, the university iBook spreadsheet, JSON feeds), keeps one
                                current version per provider, day and meal slot, and serves them back ordered
                                and paginated.

                                ---

                                ## ⚙️ How it works

                                ### **Scheduled crawl**
                                A crawl cycle runs on a fixed delay (and on demand via `POST /admin/crawl`).
                                Only one cycle runs at a time; a trigger during a running cycle returns that
                                cycle's run id.

                                ### **Versioned menus**
                                Each menu carries a content hash. A crawl that finds the same dishes changes
                                nothing; a different menu bumps `version`. Menus submitted by a vendor are
                                never overwritten by a crawl.

                                ### **Cached reads**
                                Reads go through a short-lived cache. If the database is unreachable, the last
                                cached page is still served for a grace period and flagged with `stale=true`.

                                ---

                                ### 📌 Error summary
                                | **Code** | **Meaning** |
                                |--------|-------------|
                                | **200** | Success |
                                | **202** | Crawl accepted |
                                | **400** | Invalid filter or page token |
                                | **404** | Unknown run or provider without menus |
                                | **503** | Database unavailable and nothing cached |
                                | **500** | Unexpected error |

                                ---

                                ## 🧩 Endpoints

                                """
        )
)
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .addTagsItem(new Tag().name("01 - Menus").description("Menu reads"))
                .addTagsItem(new Tag().name("02 - Admin").description("Crawler operations"));
    }
}

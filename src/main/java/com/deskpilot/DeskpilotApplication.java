package com.deskpilot;

import com.deskpilot.vector.InMemoryVectorIndex;
import com.deskpilot.vector.MongoVectorIndex;
import com.deskpilot.vector.VectorIndex;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

@SpringBootApplication
public class DeskpilotApplication {
    private static final Logger log = LoggerFactory.getLogger(DeskpilotApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DeskpilotApplication.class, args);
    }

    @Bean
    public VectorIndex vectorIndex(ObjectProvider<MongoTemplate> mongoTemplate,
                                   @Value("${deskpilot.vector.store:mongo}") String store) {
        String mode = store == null ? "mongo" : store.trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "memory":
                log.info("Using InMemoryVectorIndex (deskpilot.vector.store=memory).");
                return new InMemoryVectorIndex();
            case "mongo":
                MongoVectorIndex index = new MongoVectorIndex(mongoTemplate.getObject());
                index.ensureIndexes();
                return index;
            default:
                throw new IllegalStateException("Unknown deskpilot.vector.store '" + store + "'; expected mongo or memory");
        }
    }
}

package com.devscontext.core.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * The entity and repository packages live in devscontext-data, outside the
 * packages of both application classes.
 */
@Configuration
@EntityScan("com.devscontext.data.entity")
@EnableJpaRepositories("com.devscontext.data.repository")
public class PersistenceConfig {
}

package io.intellixity.semgate.registry.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/** Creates the registry tables if they do not exist. */
public final class RegistrySchema {
  private static final Logger log = LoggerFactory.getLogger(RegistrySchema.class);
  static final String SCRIPT = "io/intellixity/semgate/registry/schema.sql";

  private RegistrySchema() {}

  public static void apply(DataSource dataSource) {
    ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCRIPT));
    populator.execute(dataSource);
    log.info("Registry schema ready");
  }
}

package dev.linkscout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the LinkScout broken-link checker.
 *
 * <p>Runs as a non-web application: the crawl is driven once by {@link
 * dev.linkscout.cli.LinkCheckRunner} and the process exits after reporting. Options are passed as
 * command-line properties, e.g. {@code --url=https://example.com --depth=3 --export=broken.csv}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LinkScoutApplication {
  public static void main(String[] args) {
    SpringApplication.run(LinkScoutApplication.class, args);
  }
}

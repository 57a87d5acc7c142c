package com.purchasingpower.codegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "codegraph")
public class AppProperties {

    /** Root of the multi-project source tree. Usually given as {@code --root} on the command line. */
    private String root;

    /** Name of the root Repository node. Defaults to the root directory name. */
    private String repositoryName;

    /** Where the analysis document is written. Blank disables the document. */
    private String output;

    /** Whether to materialize the graph in Neo4j after analysis. */
    private boolean load = true;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DiscoveryProperties discovery = new DiscoveryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AnalysisProperties analysis = new AnalysisProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LoaderProperties loader = new LoaderProperties();
}

package io.github.yok.certdump.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Dataset catalog: the tables to extract, in processing order, and the fact tables whose foreign
 * keys are checked.
 *
 * <ul>
 * <li>{@code catalog.tables}: table names, processed sequentially</li>
 * <li>{@code catalog.fact-tables}: fact table name to its foreign-key columns</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "catalog")
@Getter
@Setter
@NoArgsConstructor
public class CatalogConfig {

    /**
     * Tables to extract.
     */
    private List<String> tables =
            ImmutableList.of("dim_pessoa", "dim_juiz", "dim_advogado", "fato_processos");

    /**
     * Fact tables and the foreign-key columns each row must have set.
     */
    private Map<String, List<String>> factTables = new LinkedHashMap<>(ImmutableMap.of(
            "fato_processos", ImmutableList.of("id_pessoa", "id_juiz", "id_advogado")));
}

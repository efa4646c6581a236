package com.wallettrace.config;

import com.wallettrace.domain.AddressCategory;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Extra or overriding registry entries. Key = address (any case), value = category and display label.
 * See application.yml wallettrace.registry.
 */
@ConfigurationProperties(prefix = "wallettrace.registry")
@NoArgsConstructor
@Getter
@Setter
public class AddressRegistryProperties {

    /** When false, only the configured entries are known. Default true. */
    private boolean builtInEntries = true;

    /** Map: address (0x...) -> entry. Configured entries win over built-in ones. */
    private Map<String, Entry> entries = new HashMap<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Entry {

        private AddressCategory category = AddressCategory.ENTITY;

        private String label;

        public Entry(AddressCategory category, String label) {
            this.category = category;
            this.label = label;
        }
    }
}

package com.astrolabe.service;

import com.astrolabe.model.AliasTable;
import com.astrolabe.model.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AliasTableLoader extends TableResourceLoader<AliasTable> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AliasTableLoader.class);

    public AliasTableLoader() {
        this(AppConfig.getAliasesResource());
    }

    public AliasTableLoader(String defaultResource) {
        super(defaultResource);
    }

    @Override
    protected AliasTable parse(List<String> lines, String sourceName) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (String line : lines) {
            if (line.startsWith(NOP_ENTRY_KEY) || line.startsWith(COLUMN_NAME_MARKER)) continue;
            List<String> flds = splitFields(line);
            if (flds.size() == 2 && !flds.get(0).isEmpty() && !flds.get(1).isEmpty()) {
                aliases.put(flds.get(0), flds.get(1));
            } else {
                LOGGER.debug("Ignoring malformed alias line in {}: '{}'", sourceName, line);
            }
        }
        LOGGER.info("Read {} field name aliases from {}", aliases.size(), sourceName);
        return new AliasTable(aliases);
    }
}

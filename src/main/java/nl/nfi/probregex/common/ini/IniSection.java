package nl.nfi.probregex.common.ini;

import java.util.List;

public final class IniSection {

    private final IniConfig iniConfig;
    private final String section;

    private IniSection(final IniConfig iniConfig, final String section) {
        this.iniConfig = iniConfig;
        this.section = section;
    }

    static IniSection ofConfig(final IniConfig iniConfig, final String section) {
        return new IniSection(iniConfig, section);
    }

    public boolean hasKey(final String key) {
        return iniConfig.hasKey(section, key);
    }

    public String getString(final String key) {
        return iniConfig.getString(section, key);
    }

    public long getLong(final String key) {
        return iniConfig.getLong(section, key);
    }

    public List<String> getStringList(final String key) {
        return iniConfig.getStringList(section, key);
    }
}

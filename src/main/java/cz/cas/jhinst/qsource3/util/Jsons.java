package cz.cas.jhinst.qsource3.util;

import com.fasterxml.jackson.databind.ObjectMapper;

public final class Jsons
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}

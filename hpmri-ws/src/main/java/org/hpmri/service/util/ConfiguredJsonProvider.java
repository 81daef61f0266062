package org.hpmri.service.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.jaxrs.json.JacksonJaxbJsonProvider;

import javax.ws.rs.Consumes;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.ext.Provider;

import org.hpmri.processing.ThresholdedSpectrum;
import org.hpmri.processing.json.JsonUtils;

/**
 * Instance of {@link JacksonJaxbJsonProvider} that uses the common configured {@link JsonUtils} mappers.
 */
@Provider
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfiguredJsonProvider extends JacksonJaxbJsonProvider {

    public ConfiguredJsonProvider() {
        super();
    }

    @Override
    protected ObjectMapper _locateMapperViaProvider(final Class<?> type,
                                                    final MediaType mediaType) {

        final ObjectMapper mapper;

        // series can be long, so skip pretty printing for them
        if (type == ThresholdedSpectrum.class) {
            mapper = JsonUtils.FAST_MAPPER;
        } else {
            mapper = JsonUtils.MAPPER;
        }

        return mapper;
    }
}

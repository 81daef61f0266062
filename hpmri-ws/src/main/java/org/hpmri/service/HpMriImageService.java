package org.hpmri.service;

import ij.process.ByteProcessor;

import java.util.Collections;
import java.util.Map;

import javax.ws.rs.Consumes;
import javax.ws.rs.DefaultValue;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import org.hpmri.processing.AcquisitionDispatcher;
import org.hpmri.processing.MagnetType;
import org.hpmri.processing.ProcessingParameters;
import org.hpmri.processing.ThresholdedSpectrum;
import org.hpmri.service.util.HpMriServiceUtil;
import org.hpmri.service.util.SharedAcquisitionDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.swagger.annotations.Api;
import io.swagger.annotations.ApiOperation;
import io.swagger.annotations.ApiParam;
import io.swagger.annotations.ApiResponse;
import io.swagger.annotations.ApiResponses;

/**
 * APIs for rendering proton slices and retrieving thresholded EPSI data.
 * Every request accepts an optional magnet type ("HUPC", "Clinical", or "MR Solutions"; default is HUPC).
 */
@Path("/api")
@Api(tags = {"HP-MRI Image APIs"})
public class HpMriImageService {

    public static final String NUM_SLIDER_VALUES_KEY = "numSliderValues";
    public static final String NUM_DATASETS_KEY = "numDatasets";

    private final AcquisitionDispatcher dispatcher;

    @SuppressWarnings("UnusedDeclaration")
    public HpMriImageService() {
        this(SharedAcquisitionDispatcher.getInstance());
    }

    public HpMriImageService(final AcquisitionDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Path("get_proton_picture/{sliderValue}")
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(HpMriServiceUtil.IMAGE_PNG_MIME_TYPE)
    @ApiOperation(value = "Render contrast enhanced 8-bit PNG image for a proton slice")
    @ApiResponses(value = {
            @ApiResponse(code = 400, message = "Unknown magnet type"),
            @ApiResponse(code = 404, message = "Slice not found")
    })
    public Response renderProtonPicture(@PathParam("sliderValue") final int sliderValue,
                                        final ProcessingParameters processingParameters) {

        LOG.info("renderProtonPicture: entry, sliderValue={}, processingParameters={}",
                 sliderValue, processingParameters);

        Response response = null;
        try {
            final ProcessingParameters parameters =
                    processingParameters == null ? new ProcessingParameters() : processingParameters;
            final ByteProcessor slice = dispatcher.renderPicture(parameters.getMagnetType(),
                                                                 sliderValue,
                                                                 parameters.getContrast());
            response = HpMriServiceUtil.getPngResponse(slice);
        } catch (final Throwable t) {
            HpMriServiceUtil.throwServiceException(t);
        }

        return response;
    }

    @Path("get_num_slider_values")
    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @ApiOperation(value = "Number of proton slices available for a magnet type")
    @ApiResponses(value = {
            @ApiResponse(code = 400, message = "Unknown magnet type")
    })
    public Map<String, Integer> getNumSliderValues(@ApiParam(value = "Magnet type (default is HUPC)")
                                                   @QueryParam("magnetType") final String magnetType) {

        LOG.info("getNumSliderValues: entry, magnetType={}", magnetType);

        Map<String, Integer> result = null;
        try {
            final int count = dispatcher.getImageCount(MagnetType.fromDiscriminator(magnetType));
            result = Collections.singletonMap(NUM_SLIDER_VALUES_KEY, count);
        } catch (final Throwable t) {
            HpMriServiceUtil.throwServiceException(t);
        }

        return result;
    }

    @Path("get_num_datasets")
    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @ApiOperation(value = "Number of EPSI datasets available for a magnet type (zero if unsupported)")
    @ApiResponses(value = {
            @ApiResponse(code = 400, message = "Unknown magnet type")
    })
    public Map<String, Integer> getNumDatasets(@ApiParam(value = "Magnet type (default is HUPC)")
                                               @QueryParam("magnetType") final String magnetType) {

        LOG.info("getNumDatasets: entry, magnetType={}", magnetType);

        Map<String, Integer> result = null;
        try {
            final int count = dispatcher.getSpectrumCount(MagnetType.fromDiscriminator(magnetType));
            result = Collections.singletonMap(NUM_DATASETS_KEY, count);
        } catch (final Throwable t) {
            HpMriServiceUtil.throwServiceException(t);
        }

        return result;
    }

    @Path("get_hp_mri_data/{hpMriDataset}")
    @POST
    @Produces(MediaType.APPLICATION_JSON)
    @ApiOperation(
            value = "Thresholded EPSI series for a dataset",
            notes = "Samples below the threshold are zeroed. " +
                    "Magnet types without spectroscopic capability return an empty unsupported result.")
    @ApiResponses(value = {
            @ApiResponse(code = 400, message = "Unknown magnet type or invalid threshold"),
            @ApiResponse(code = 404, message = "Dataset not found")
    })
    public ThresholdedSpectrum getHpMriData(@PathParam("hpMriDataset") final int hpMriDataset,
                                            @ApiParam(value = "Threshold applied to peak normalized values")
                                            @QueryParam("threshold") @DefaultValue("0.2") final double threshold,
                                            @ApiParam(value = "Magnet type (default is HUPC)")
                                            @QueryParam("magnetType") final String magnetType) {

        LOG.info("getHpMriData: entry, hpMriDataset={}, threshold={}, magnetType={}",
                 hpMriDataset, threshold, magnetType);

        ThresholdedSpectrum spectrum = null;
        try {
            spectrum = dispatcher.getThresholdedData(magnetType, hpMriDataset, threshold);
        } catch (final Throwable t) {
            HpMriServiceUtil.throwServiceException(t);
        }

        return spectrum;
    }

    private static final Logger LOG = LoggerFactory.getLogger(HpMriImageService.class);
}

package com.texsynth.server.controller;

import com.texsynth.server.imaging.PixelBufferImages;
import com.texsynth.server.service.CacheControlService;
import com.texsynth.server.service.TextureSynthesisService;
import com.texsynth.server.synthesis.PixelBuffer;
import com.texsynth.server.synthesis.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

@RestController
public class SynthesisController {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisController.class);
    private final TextureSynthesisService synthesisService;
    private final CacheControlService cacheControlService;

    public SynthesisController(TextureSynthesisService synthesisService, CacheControlService cacheControlService) {
        this.synthesisService = synthesisService;
        this.cacheControlService = cacheControlService;
    }

    public static class SynthesisRequest {
        // pixels[row][col][channel], values typically in [0, 1]
        public double[][][] pixels;
        public int outputRows;
        public int outputCols;
        public Integer windowSize;
        public Long seed;
    }

    public static class SynthesisResponse {
        public double[][][] pixels;
        public int windowSize;
        public int passes;
        public int thresholdRelaxations;
        public double finalMaxErrorThreshold;
        public boolean cached;
    }

    @PostMapping("/synthesize")
    public ResponseEntity<?> synthesize(@RequestBody SynthesisRequest request) {
        PixelBuffer sample;
        try {
            sample = PixelBuffer.of(request.pixels);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid sample pixels: " + e.getMessage());
        }

        logger.info("Received synthesis request: sample={}, output={}x{}", sample, request.outputRows,
                request.outputCols);

        SynthesisResult result;
        try {
            result = synthesisService.synthesize(sample, request.outputRows, request.outputCols, request.windowSize,
                    request.seed);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }

        SynthesisResponse response = new SynthesisResponse();
        response.pixels = result.getOutput().toArray();
        response.windowSize = result.getWindowSize();
        response.passes = result.getPasses();
        response.thresholdRelaxations = result.getThresholdRelaxations();
        response.finalMaxErrorThreshold = result.getFinalMaxErrorThreshold();
        response.cached = result.isFromCache();
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/synthesize-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> synthesizeImage(@RequestParam("file") MultipartFile file,
            @RequestParam("outputRows") int outputRows,
            @RequestParam("outputCols") int outputCols,
            @RequestParam(value = "windowSize", required = false) Integer windowSize,
            @RequestParam(value = "seed", required = false) Long seed,
            @RequestParam(value = "grayscale", defaultValue = "false") boolean grayscale) {
        PixelBuffer sample;
        try {
            sample = PixelBufferImages.decode(file.getBytes(), grayscale);
        } catch (IOException e) {
            return ResponseEntity.badRequest().body("Could not decode uploaded image: " + e.getMessage());
        }

        logger.info("Received image synthesis request: file={}, sample={}, output={}x{}",
                file.getOriginalFilename(), sample, outputRows, outputCols);

        try {
            SynthesisResult result = synthesisService.synthesize(sample, outputRows, outputCols, windowSize, seed);
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .header("X-Synthesis-Passes", String.valueOf(result.getPasses()))
                    .header("X-Synthesis-Cached", String.valueOf(result.isFromCache()))
                    .body(PixelBufferImages.encodePng(result.getOutput()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (IOException e) {
            logger.error("Failed to encode synthesized image", e);
            return ResponseEntity.internalServerError().body("Failed to encode output image");
        }
    }

    @DeleteMapping("/cache")
    public ResponseEntity<?> clearCache() {
        int removed = cacheControlService.clearCurrentEngine();
        Map<String, Object> body = new HashMap<>();
        body.put("removed", removed);
        return ResponseEntity.ok(body);
    }
}

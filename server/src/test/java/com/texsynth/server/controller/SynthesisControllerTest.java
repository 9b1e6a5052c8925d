package com.texsynth.server.controller;

import com.texsynth.server.config.SynthesisConfig;
import com.texsynth.server.imaging.PixelBufferImages;
import com.texsynth.server.service.CacheControlService;
import com.texsynth.server.service.TextureSynthesisService;
import com.texsynth.server.synthesis.PixelBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SynthesisControllerTest {

    @TempDir
    Path tempDir;

    private SynthesisController controller;

    @BeforeEach
    public void setup() {
        String dbPath = tempDir.resolve("controller_cache.db").toString();
        SynthesisConfig.ConfigRoot config = SynthesisConfig.defaults();
        config.cache.enabled = true;
        controller = new SynthesisController(new TextureSynthesisService(config, dbPath),
                new CacheControlService(dbPath));
    }

    private static double[][][] checkerSample() {
        double[][][] pixels = new double[6][6][1];
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 6; c++) {
                pixels[r][c][0] = (r + c) % 2 == 0 ? 0.0 : 1.0;
            }
        }
        return pixels;
    }

    private static SynthesisController.SynthesisRequest request(long seed) {
        SynthesisController.SynthesisRequest request = new SynthesisController.SynthesisRequest();
        request.pixels = checkerSample();
        request.outputRows = 8;
        request.outputCols = 10;
        request.windowSize = 3;
        request.seed = seed;
        return request;
    }

    @Test
    public void testSynthesizeReturnsFullOutput() {
        ResponseEntity<?> response = controller.synthesize(request(42L));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        SynthesisController.SynthesisResponse body = (SynthesisController.SynthesisResponse) response.getBody();
        assertNotNull(body);
        assertEquals(8, body.pixels.length);
        assertEquals(10, body.pixels[0].length);
        assertEquals(1, body.pixels[0][0].length);
        assertEquals(3, body.windowSize);
        assertFalse(body.cached);
        for (double[][] row : body.pixels) {
            for (double[] pixel : row) {
                assertTrue(pixel[0] == 0.0 || pixel[0] == 1.0);
            }
        }
    }

    @Test
    public void testRepeatedSeededRequestIsCachedUntilCleared() {
        controller.synthesize(request(7L));
        SynthesisController.SynthesisResponse second =
                (SynthesisController.SynthesisResponse) controller.synthesize(request(7L)).getBody();
        assertTrue(second.cached);

        ResponseEntity<?> cleared = controller.clearCache();
        assertEquals(HttpStatus.OK, cleared.getStatusCode());
        assertEquals(1, ((Map<?, ?>) cleared.getBody()).get("removed"));

        SynthesisController.SynthesisResponse third =
                (SynthesisController.SynthesisResponse) controller.synthesize(request(7L)).getBody();
        assertFalse(third.cached);
    }

    @Test
    public void testBadRequests() {
        SynthesisController.SynthesisRequest tooSmall = request(1L);
        tooSmall.outputRows = 2;
        assertEquals(HttpStatus.BAD_REQUEST, controller.synthesize(tooSmall).getStatusCode());

        SynthesisController.SynthesisRequest hugeWindow = request(1L);
        hugeWindow.windowSize = 9;
        assertEquals(HttpStatus.BAD_REQUEST, controller.synthesize(hugeWindow).getStatusCode());

        SynthesisController.SynthesisRequest ragged = request(1L);
        ragged.pixels[2] = new double[3][1];
        assertEquals(HttpStatus.BAD_REQUEST, controller.synthesize(ragged).getStatusCode());

        SynthesisController.SynthesisRequest missing = request(1L);
        missing.pixels = null;
        assertEquals(HttpStatus.BAD_REQUEST, controller.synthesize(missing).getStatusCode());
    }

    @Test
    public void testSynthesizeImageReturnsPng() throws Exception {
        byte[] png = PixelBufferImages.encodePng(PixelBuffer.of(checkerSample()));
        MockMultipartFile file = new MockMultipartFile("file", "checker.png", "image/png", png);

        ResponseEntity<?> response = controller.synthesizeImage(file, 9, 7, 3, 5L, true);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(MediaType.IMAGE_PNG, response.getHeaders().getContentType());
        assertEquals("false", response.getHeaders().getFirst("X-Synthesis-Cached"));
        PixelBuffer output = PixelBufferImages.decode((byte[]) response.getBody(), true);
        assertEquals(9, output.getRows());
        assertEquals(7, output.getCols());
    }

    @Test
    public void testUndecodableUploadIsRejected() {
        MockMultipartFile file = new MockMultipartFile("file", "junk.png", "image/png", new byte[] { 9, 9, 9 });
        assertEquals(HttpStatus.BAD_REQUEST, controller.synthesizeImage(file, 9, 7, 3, 5L, false).getStatusCode());
    }
}

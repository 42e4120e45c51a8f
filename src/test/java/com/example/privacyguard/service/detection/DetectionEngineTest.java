package com.example.privacyguard.service.detection;

import com.example.privacyguard.config.PrivacyGuardProperties;
import com.example.privacyguard.model.BoundingBox;
import com.example.privacyguard.model.DetectionCategory;
import com.example.privacyguard.service.backend.ConfidenceBand;
import com.example.privacyguard.service.backend.ModelBackendAdapter;
import com.example.privacyguard.service.backend.ModelBackendAdapter.BackendChain;
import com.example.privacyguard.service.backend.RawDetection;
import com.example.privacyguard.service.backend.StubBackend;
import com.example.privacyguard.util.OpenCvRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionEngineTest {

    private static final ConfidenceBand LEARNED = new ConfidenceBand(0.3, 0.8);
    private static final ConfidenceBand CLASSICAL = new ConfidenceBand(0.1, 0.3);

    private PrivacyGuardProperties properties;
    private Mat image;

    @BeforeAll
    static void loadOpenCv() {
        OpenCvRuntime.ensureLoaded();
    }

    @BeforeEach
    void setUp() {
        properties = new PrivacyGuardProperties();
        image = new Mat(300, 400, CvType.CV_8UC3, new Scalar(128, 128, 128));
    }

    @AfterEach
    void tearDown() {
        image.release();
    }

    @Test
    void facesAreClampedAndPadded() {
        StubBackend faces = new StubBackend("ssd", LEARNED, List.of(new RawDetection(-10, 5, 50, 50, 0.9)));
        DetectionEngine engine = engine(new BackendChain(faces, null), BackendChain.empty());

        List<BoundingBox> boxes = engine.detect(image, true, false, 50);

        assertThat(boxes).containsExactly(new BoundingBox(0, 1, 44, 58, 0.9, DetectionCategory.FACE));
    }

    @Test
    void platesRunThroughGeometricFilters() {
        StubBackend plates = new StubBackend("yolo", LEARNED, List.of(
                new RawDetection(100, 200, 120, 30, 0.9),
                new RawDetection(100, 10, 120, 30, 0.9),
                new RawDetection(20, 120, 300, 120, 0.9)));
        DetectionEngine engine = engine(BackendChain.empty(), new BackendChain(plates, null));

        List<BoundingBox> boxes = engine.detect(image, false, true, 50);

        assertThat(boxes).containsExactly(new BoundingBox(106, 201, 108, 28, 0.9, DetectionCategory.LICENSE_PLATE));
    }

    @Test
    void defaultConfidenceFloorRejectsWeakPlatesEvenAtFullSensitivity() {
        ConfidenceBand yolo = new ConfidenceBand(0.15, 0.60);
        StubBackend plates = new StubBackend("yolo", yolo, List.of(
                new RawDetection(100, 200, 120, 30, 0.20),
                new RawDetection(250, 150, 120, 30, 0.30)));
        DetectionEngine engine = engine(BackendChain.empty(), new BackendChain(plates, null));

        List<BoundingBox> boxes = engine.detect(image, false, true, 100);

        assertThat(boxes).extracting(BoundingBox::confidence).containsExactly(0.30);
    }

    @Test
    void higherSensitivityNeverFindsFewerRegions() {
        List<RawDetection> raw = List.of(
                new RawDetection(10, 10, 40, 40, 0.2),
                new RawDetection(60, 10, 40, 40, 0.4),
                new RawDetection(110, 10, 40, 40, 0.6),
                new RawDetection(160, 10, 40, 40, 0.85));
        DetectionEngine engine = engine(new BackendChain(new StubBackend("ssd", LEARNED, raw), null),
                BackendChain.empty());

        int previous = -1;
        for (int sensitivity = 0; sensitivity <= 100; sensitivity += 10) {
            int count = engine.detect(image, true, false, sensitivity).size();
            assertThat(count).isGreaterThanOrEqualTo(previous);
            previous = count;
        }
        assertThat(engine.detect(image, true, false, 0)).hasSize(1);
        assertThat(engine.detect(image, true, false, 100)).hasSize(3);
    }

    @Test
    void thresholdFollowsTheBandOfTheServingBackend() {
        List<RawDetection> raw = List.of(new RawDetection(10, 10, 40, 40, 0.25));
        StubBackend learned = new StubBackend("ssd", LEARNED, raw).failingOnLoad();
        StubBackend classical = new StubBackend("haar", CLASSICAL, raw);
        DetectionEngine engine = engine(new BackendChain(learned, classical), BackendChain.empty());

        // 0.25 fails every learned threshold but passes the classical one at sensitivity 50 (0.2).
        assertThat(engine.detect(image, true, false, 50)).hasSize(1);
    }

    @Test
    void failingCapabilityDoesNotAbortTheOther() {
        StubBackend faces = new StubBackend("ssd", LEARNED, List.of()).failingOnDetect();
        StubBackend plates = new StubBackend("yolo", LEARNED, List.of(new RawDetection(100, 200, 120, 30, 0.9)));
        DetectionEngine engine = engine(new BackendChain(faces, null), new BackendChain(plates, null));

        List<BoundingBox> boxes = engine.detect(image, true, true, 60);

        assertThat(boxes).singleElement()
                .extracting(BoundingBox::category)
                .isEqualTo(DetectionCategory.LICENSE_PLATE);
    }

    @Test
    void unavailableCapabilityYieldsNoRegions() {
        StubBackend faces = new StubBackend("ssd", LEARNED, List.of()).failingOnLoad();
        DetectionEngine engine = engine(new BackendChain(faces, null), BackendChain.empty());

        assertThat(engine.detect(image, true, true, 100)).isEmpty();
    }

    @Test
    void disabledCategoriesAreNotQueried() {
        StubBackend faces = new StubBackend("ssd", LEARNED, List.of(new RawDetection(10, 10, 40, 40, 0.9)));
        DetectionEngine engine = engine(new BackendChain(faces, null), BackendChain.empty());

        assertThat(engine.detect(image, false, false, 100)).isEmpty();
        assertThat(faces.loadCalls()).isZero();
    }

    @Test
    void everyReturnedBoxLiesInsideTheImage() {
        Random random = new Random(42);
        List<RawDetection> raw = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            raw.add(new RawDetection(random.nextInt(600) - 100, random.nextInt(500) - 100,
                    1 + random.nextInt(250), 1 + random.nextInt(120), random.nextDouble()));
        }
        properties.getPlate().getFilters().setAspectEnabled(false);
        properties.getPlate().getFilters().setVerticalPositionEnabled(false);
        properties.getPlate().getFilters().setSizeEnabled(false);
        DetectionEngine engine = engine(new BackendChain(new StubBackend("ssd", LEARNED, raw), null),
                new BackendChain(new StubBackend("yolo", LEARNED, raw), null));

        List<BoundingBox> boxes = engine.detect(image, true, true, 100);

        assertThat(boxes).isNotEmpty().allSatisfy(box -> {
            assertThat(box.x()).isGreaterThanOrEqualTo(0);
            assertThat(box.y()).isGreaterThanOrEqualTo(0);
            assertThat(box.width()).isPositive();
            assertThat(box.height()).isPositive();
            assertThat(box.x() + box.width()).isLessThanOrEqualTo(image.cols());
            assertThat(box.y() + box.height()).isLessThanOrEqualTo(image.rows());
        });
    }

    private DetectionEngine engine(BackendChain faces, BackendChain plates) {
        ModelBackendAdapter adapter = new ModelBackendAdapter(Map.of(
                DetectionCategory.FACE, faces,
                DetectionCategory.LICENSE_PLATE, plates));
        return new DetectionEngine(adapter, properties);
    }
}

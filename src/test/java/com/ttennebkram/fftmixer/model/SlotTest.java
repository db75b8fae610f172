package com.ttennebkram.fftmixer.model;

import com.ttennebkram.fftmixer.TestImages;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.junit.jupiter.api.Assertions.*;

class SlotTest {

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void newSlotIsEmptyWithDefaults() {
        Slot slot = new Slot(2);
        assertFalse(slot.isLoaded());
        assertNull(slot.getImage());
        assertEquals(0, slot.getBrightness());
        assertEquals(1.0, slot.getContrast());
        assertEquals(0.0, slot.getWeight());
        assertNull(slot.getComponent());
    }

    @Test
    void contrastClampedAtZeroBrightnessUnbounded() {
        Slot slot = new Slot(0);
        slot.setContrast(-0.5);
        assertEquals(0.0, slot.getContrast());
        slot.setBrightness(-400);
        assertEquals(-400, slot.getBrightness());
    }

    @Test
    void weightClampedToUnitInterval() {
        Slot slot = new Slot(0);
        slot.setWeight(1.7);
        assertEquals(1.0, slot.getWeight());
        slot.setWeight(-0.2);
        assertEquals(0.0, slot.getWeight());
        slot.setWeight(Double.NaN);
        assertEquals(0.0, slot.getWeight());
    }

    @Test
    void setImageCopiesAndConvertsToGray() {
        Mat color = new Mat(10, 12, CvType.CV_8UC3, new Scalar(10, 20, 30));
        Slot slot = new Slot(0);
        slot.setImage(color);
        color.setTo(new Scalar(0, 0, 0));

        assertTrue(slot.isLoaded());
        assertEquals(CvType.CV_8UC1, slot.getImage().type());
        assertTrue(TestImages.valueAt(slot.getImage(), 0, 0) > 0);
        color.release();
    }

    @Test
    void clearResetsEverything() {
        Slot slot = new Slot(1);
        Mat image = TestImages.gradient(8, 8);
        slot.setImage(image);
        slot.setBrightness(12);
        slot.setContrast(2.5);
        slot.setWeight(0.4);
        slot.setComponent(ComponentVariant.PHASE);

        slot.clear();

        assertFalse(slot.isLoaded());
        assertEquals(Slot.DEFAULT_BRIGHTNESS, slot.getBrightness());
        assertEquals(Slot.DEFAULT_CONTRAST, slot.getContrast());
        assertEquals(0.0, slot.getWeight());
        assertNull(slot.getComponent());
        image.release();
    }
}

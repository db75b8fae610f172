package com.ttennebkram.fftmixer.processing;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared FFT helpers for the analyzer and the mixing engine.
 * Spectra are CV_64FC2 Mats (real, imaginary) with the DC term centered.
 */
public final class SpectrumMath {

    private SpectrumMath() {
    }

    /**
     * 2D DFT of a single-channel raster, shifted so the zero frequency is centered.
     * The transform is taken at the raster's exact size (no padding).
     *
     * @return new CV_64FC2 spectrum (caller must release)
     */
    public static Mat centeredSpectrum(Mat gray) {
        if (gray.channels() != 1) {
            throw new IllegalArgumentException("Expected a single-channel raster, got " + gray.channels() + " channels");
        }

        Mat floatInput = new Mat();
        gray.convertTo(floatInput, CvType.CV_64F);

        Mat complexI = new Mat();
        List<Mat> planes = new ArrayList<>();
        planes.add(floatInput);
        planes.add(Mat.zeros(floatInput.size(), CvType.CV_64F));
        Core.merge(planes, complexI);
        planes.get(1).release();
        floatInput.release();

        Core.dft(complexI, complexI, Core.DFT_COMPLEX_OUTPUT);

        Mat shifted = fftShift(complexI);
        complexI.release();
        return shifted;
    }

    /**
     * Move the zero frequency to the center. Handles odd sizes (roll by floor(n/2)).
     */
    public static Mat fftShift(Mat input) {
        return roll(input, input.rows() / 2, input.cols() / 2);
    }

    /**
     * Undo {@link #fftShift(Mat)}.
     */
    public static Mat ifftShift(Mat input) {
        return roll(input, -(input.rows() / 2), -(input.cols() / 2));
    }

    /**
     * Circularly shift rows and columns; element (r, c) lands on
     * ((r + shiftRows) mod rows, (c + shiftCols) mod cols).
     *
     * @return new Mat of the same size and type
     */
    public static Mat roll(Mat input, int shiftRows, int shiftCols) {
        int rows = input.rows();
        int cols = input.cols();
        int sy = Math.floorMod(shiftRows, rows);
        int sx = Math.floorMod(shiftCols, cols);

        Mat output = new Mat(input.size(), input.type());

        // {source start, destination start, length}
        int[][] rowSpans = {{0, sy, rows - sy}, {rows - sy, 0, sy}};
        int[][] colSpans = {{0, sx, cols - sx}, {cols - sx, 0, sx}};

        for (int[] r : rowSpans) {
            for (int[] c : colSpans) {
                if (r[2] == 0 || c[2] == 0) {
                    continue;
                }
                Mat from = input.submat(new Rect(c[0], r[0], c[2], r[2]));
                Mat to = output.submat(new Rect(c[1], r[1], c[2], r[2]));
                from.copyTo(to);
                from.release();
                to.release();
            }
        }
        return output;
    }

    /**
     * Split a complex Mat into its real and imaginary planes.
     */
    public static List<Mat> split(Mat complex) {
        List<Mat> planes = new ArrayList<>();
        Core.split(complex, planes);
        return planes;
    }

    /**
     * Merge two planes into a complex Mat and release the planes.
     */
    public static Mat mergeAndRelease(Mat real, Mat imag) {
        Mat complex = new Mat();
        List<Mat> planes = new ArrayList<>();
        planes.add(real);
        planes.add(imag);
        Core.merge(planes, complex);
        real.release();
        imag.release();
        return complex;
    }

    /**
     * Elementwise argument atan2(imag, real) in (-pi, pi].
     * Zero coefficients (including signed zeros left by masking) have phase 0.
     */
    public static Mat phase(Mat real, Mat imag) {
        int total = (int) real.total();
        double[] re = new double[total];
        double[] im = new double[total];
        real.get(0, 0, re);
        imag.get(0, 0, im);

        double[] angle = new double[total];
        for (int i = 0; i < total; i++) {
            angle[i] = (re[i] == 0.0 && im[i] == 0.0) ? 0.0 : Math.atan2(im[i], re[i]);
        }

        Mat result = new Mat(real.size(), CvType.CV_64F);
        result.put(0, 0, angle);
        return result;
    }

    /**
     * Unit phasors exp(i * phase) scaled by weight, as a complex Mat.
     */
    public static Mat weightedUnitPhasor(Mat real, Mat imag, double weight) {
        int total = (int) real.total();
        double[] re = new double[total];
        double[] im = new double[total];
        real.get(0, 0, re);
        imag.get(0, 0, im);

        double[] outRe = new double[total];
        double[] outIm = new double[total];
        for (int i = 0; i < total; i++) {
            double angle = (re[i] == 0.0 && im[i] == 0.0) ? 0.0 : Math.atan2(im[i], re[i]);
            outRe[i] = weight * Math.cos(angle);
            outIm[i] = weight * Math.sin(angle);
        }

        Mat phasorRe = new Mat(real.size(), CvType.CV_64F);
        Mat phasorIm = new Mat(real.size(), CvType.CV_64F);
        phasorRe.put(0, 0, outRe);
        phasorIm.put(0, 0, outIm);
        return mergeAndRelease(phasorRe, phasorIm);
    }

    /**
     * log(1 + |x|) elementwise.
     */
    public static Mat log1pAbs(Mat input) {
        Mat result = new Mat();
        Core.absdiff(input, Scalar.all(0), result);
        Core.add(result, Scalar.all(1), result);
        Core.log(result, result);
        return result;
    }

    /**
     * Min-max rescale to [0, 255] and convert to 8 bits.
     * A constant field maps to all zeros.
     */
    public static Mat normalizeTo8U(Mat input) {
        Mat scaled = new Mat();
        Core.normalize(input, scaled, 0, 255, Core.NORM_MINMAX);
        Mat output = new Mat();
        scaled.convertTo(output, CvType.CV_8U);
        scaled.release();
        return output;
    }
}

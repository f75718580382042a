package com.astroiq.service;

import com.astroiq.exception.FittingException;
import com.astroiq.model.FitMethod;
import com.astroiq.model.FitResult;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.SimpleCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ajuste por minimos cuadrados (Levenberg-Marquardt) de perfiles 1D gaussianos o de Moffat.
 * <p>
 * Todos los ajustes de una misma instancia se serializan con su propio lock; instancias distintas
 * pueden ajustar en paralelo.
 */
public class CurveFitter {
    private static final Logger logger = LoggerFactory.getLogger(CurveFitter.class);

    private static final int MAX_ITERATIONS = 1000;

    private static final Map<FitMethod, ParametricUnivariateFunction> MODELS;
    static {
        Map<FitMethod, ParametricUnivariateFunction> m = new EnumMap<>(FitMethod.class);
        m.put(FitMethod.GAUSSIAN, new GaussianModel());
        m.put(FitMethod.MOFFAT, new MoffatModel());
        MODELS = Collections.unmodifiableMap(m);
    }

    private final ReentrantLock lock = new ReentrantLock();

    public static double gaussian(double x, double mean, double sdev, double amp) {
        return FitMethod.GAUSSIAN.value(x, mean, sdev, amp);
    }

    public static double moffat(double x, double mean, double width, double power, double amp) {
        return FitMethod.MOFFAT.value(x, mean, width, power, amp);
    }

    public FitResult fitProfile(double[] profile, FitMethod method) throws FittingException {
        return fitProfile(profile, null, method);
    }

    /**
     * @param background fondo a restar; si es null se usa la mediana del propio perfil
     */
    public FitResult fitProfile(double[] profile, Double background, FitMethod method) throws FittingException {
        int n = profile.length;
        double medv = (background != null) ? background : PixelStatistics.median(profile);
        if (!Double.isFinite(medv)) throw new FittingException(method + " fitting failed: no finite background");

        // a. restar el fondo
        double[] y = new double[n];
        double maxv = Double.NEGATIVE_INFINITY;
        int valid = 0;
        for (int i = 0; i < n; i++) {
            y[i] = profile[i] - medv;
            if (Double.isFinite(y[i])) {
                valid++;
                if (y[i] > maxv) maxv = y[i];
            }
        }
        if (valid < method.parameterCount())
            throw new FittingException(String.format("%s fitting failed: %d valid samples for %d parameters", method, valid, method.parameterCount()));
        if (!(maxv > 0)) throw new FittingException(method + " fitting failed: no signal above background");

        // b. recortar a 0..max (perfil ya sin fondo)
        WeightedObservedPoints obs = new WeightedObservedPoints();
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(y[i])) obs.add(i, Math.min(Math.max(y[i], 0.0), maxv));
        }

        double[] start = initialGuess(method, n, maxv);
        double[] p1;
        lock.lock();
        try {
            p1 = SimpleCurveFitter.create(MODELS.get(method), start)
                    .withMaxIterations(MAX_ITERATIONS)
                    .fit(obs.toList());
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new FittingException(method + " fitting failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }

        for (double p : p1) {
            if (!Double.isFinite(p)) throw new FittingException(method + " fitting failed: non-finite parameters");
        }
        FitResult res = new FitResult(method, p1);
        if (!(res.fwhm > 0) || !Double.isFinite(res.fwhm))
            throw new FittingException(method + " fitting failed: invalid fwhm " + res.fwhm);
        logger.debug("{}", res);
        return res;
    }

    public boolean isFitting() {
        return lock.isLocked();
    }

    static double[] initialGuess(FitMethod method, int n, double maxv) {
        double mean = (n - 1) / 2.0;
        double width = Math.max(1.0, n / 4.0);
        switch (method) {
            case MOFFAT:
                return new double[]{mean, width, 2.0, maxv};
            case GAUSSIAN:
            default:
                // altura inicial del pico = maximo observado
                return new double[]{mean, width, maxv * width * Math.sqrt(2 * Math.PI)};
        }
    }

    /** (mean, sdev, amp) */
    private static class GaussianModel implements ParametricUnivariateFunction {
        @Override
        public double value(double x, double... p) {
            return FitMethod.GAUSSIAN.value(x, p);
        }

        @Override
        public double[] gradient(double x, double... p) {
            double d = x - p[0], s = p[1];
            double g = Math.exp(-(d * d) / (2 * s * s)) / (s * Math.sqrt(2 * Math.PI));
            double f = g * p[2];
            return new double[]{
                    f * d / (s * s),
                    f * ((d * d) / (s * s * s) - 1.0 / s),
                    g
            };
        }
    }

    /** (mean, width, power, amp) */
    private static class MoffatModel implements ParametricUnivariateFunction {
        @Override
        public double value(double x, double... p) {
            return FitMethod.MOFFAT.value(x, p);
        }

        @Override
        public double[] gradient(double x, double... p) {
            double d = x - p[0], w = p[1], pw = p[2], a = p[3];
            double u = 1.0 + (d * d) / (w * w);
            double base = Math.pow(u, -pw);
            double dBase = Math.pow(u, -pw - 1.0);
            return new double[]{
                    2.0 * a * pw * d * dBase / (w * w),
                    2.0 * a * pw * d * d * dBase / (w * w * w),
                    -a * base * Math.log(u),
                    base
            };
        }
    }
}

package com.astroiq.service;

import com.astroiq.model.ObjectCandidate;
import com.astroiq.model.PickReport;
import com.astroiq.model.PlateScale;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class PickReportServiceTest {

    private final PickReportService service = new PickReportService();

    private static ObjectCandidate candidate() {
        return new ObjectCandidate(12, 20, 12.3, 19.8, 12.2, 19.9, 3.5, 3.0, 4.0, 15, 0.75,
                100.0, 145.0, 880.0, 0.99, null, null);
    }

    @Test
    public void testReportWithScale() {
        PickReport r = service.makeReport(candidate(), new PlateScale(0.0001, 0.0001), 1.0);
        assertEquals(13.3, r.x, 1e-12);
        assertEquals(20.8, r.y, 1e-12);
        assertEquals(3.5, r.fwhm, 0);
        assertEquals(0.75, r.ellipticity, 0);
        assertEquals(145.0, r.skylevel, 0);
        assertEquals(880.0, r.brightness, 0);
        assertEquals((3.0 * 0.0001 + 4.0 * 0.0001) / 2.0 * 3600.0, r.starsize, 1e-12);
    }

    @Test
    public void testReportWithoutScale() {
        PickReport r = service.makeReport(candidate(), null, 0.0);
        assertEquals(12.3, r.x, 0);
        assertEquals(0.0, r.starsize, 0);
    }
}

package com.example.ctdose.util.export;

import com.example.ctdose.dto.Acquisition;
import com.example.ctdose.dto.AcquisitionParams;
import com.example.ctdose.dto.CtDose;
import com.example.ctdose.dto.DeviceInfo;
import com.example.ctdose.dto.EssentialInfo;
import com.example.ctdose.dto.IrradiationInfo;
import com.example.ctdose.dto.Report;
import com.example.ctdose.dto.XraySourceParams;

import java.util.Arrays;
import java.util.Collections;

/**
 * 导出测试用报告
 */
final class ReportSamples {

    private ReportSamples() {
    }

    static Report twoAcquisitions() {
        Acquisition head = new Acquisition("Head Routine", "Head", "Spiral Acquisition", "Diagnostic",
                "1.2.840.1", "Head 5.0 H31s",
                new AcquisitionParams("8.5 s", "180.5 mm", "0.6 mm", "19.2 mm", "1 X-Ray sources", "0.55 ratio"),
                new XraySourceParams("A", "120 kV", "350 mA", "280 mA", "1 s"),
                new CtDose("45.5 mGy", "IEC Head Dosimetry Phantom", "400.12 mGy.cm", "50.1 mGy", null));
        Acquisition neck = new Acquisition("Head Routine", "Neck", "Constant Angle Acquisition", null,
                "1.2.840.2", null, null,
                new XraySourceParams("A", "100 kV", null, "35 mA", null),
                new CtDose("2.3 mGy", null, "44.9 mGy.cm", null, "1000 mGy"));

        return new Report("Santa Casa Hospital", "May 5, 2025 10:32:11 AM",
                new EssentialInfo("123456", "7788", "99001122", "May 5, 2025", "Jul 1, 1997", "M"),
                new DeviceInfo("CT01", "Siemens", "SOMATOM go.Up", "112233", "Radiology Room 2"),
                new IrradiationInfo("May 5, 2025 10:01:02 AM", "May 5, 2025 10:05:40 AM", "2 events", "445.02 mGy.cm"),
                Arrays.asList(head, neck));
    }

    static Report withoutPatientId() {
        return new Report(null, "Jan 1, 2025", EssentialInfo.empty(), null, null, Collections.emptyList());
    }
}

package com.warehouse.requisitions.service;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;

/**
 * Renders the requisition code as a PNG QR image for printed pick slips.
 */
@Service
public class QrCodeService {

    static final int MIN_SIZE = 50;
    static final int MAX_SIZE = 1000;

    public byte[] generatePickSlipQr(String requisitionCode, int size) throws WriterException, IOException {
        int side = Math.max(MIN_SIZE, Math.min(MAX_SIZE, size));
        QRCodeWriter qrCodeWriter = new QRCodeWriter();
        BitMatrix bitMatrix = qrCodeWriter.encode(requisitionCode, BarcodeFormat.QR_CODE, side, side,
                Map.of(EncodeHintType.MARGIN, 1));

        ByteArrayOutputStream pngOutputStream = new ByteArrayOutputStream();
        MatrixToImageWriter.writeToStream(bitMatrix, "PNG", pngOutputStream);
        return pngOutputStream.toByteArray();
    }
}

package xyz.jphil.drive_ocr.tools.job;

import xyz.jphil.drive_ocr.tools.LogFormatter;
import xyz.jphil.drive_ocr.tools.drive.CredentialProvider;
import xyz.jphil.drive_ocr.tools.drive.RemoteOcrClient;
import xyz.jphil.drive_ocr.tools.output.OutputWriter;
import xyz.jphil.drive_ocr.tools.pdf.PageSplitter;

/**
 * Everything a conversion job depends on, passed explicitly
 */
public record ConversionContext(
    CredentialProvider credentials,
    ConversionSettings settings,
    RemoteOcrClient remoteClient,
    PageSplitter splitter,
    OutputWriter writer,
    LogFormatter log
) {}

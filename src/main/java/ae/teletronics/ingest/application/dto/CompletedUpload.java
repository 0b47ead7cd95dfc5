package ae.teletronics.ingest.application.dto;

import ae.teletronics.ingest.domain.model.UploadSession;

/** Fully assembled content of a finished chunked upload. */
public record CompletedUpload(byte[] bytes, UploadSession session) {}

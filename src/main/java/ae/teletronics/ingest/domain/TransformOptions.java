package ae.teletronics.ingest.domain;

/**
 * Provider-neutral transformation request. Null fields mean "keep the original".
 *
 * @param width       target width in pixels
 * @param height      target height in pixels
 * @param crop        crop mode understood by the provider (e.g. "fill", "limit")
 * @param quality     1-100
 * @param format      target format (e.g. "webp")
 * @param progressive progressive encoding / compression flag
 */
public record TransformOptions(Integer width,
                               Integer height,
                               String crop,
                               Integer quality,
                               String format,
                               boolean progressive) {

    public boolean isIdentity() {
        return width == null && height == null && quality == null && format == null && !progressive;
    }
}

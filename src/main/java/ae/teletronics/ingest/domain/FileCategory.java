package ae.teletronics.ingest.domain;

/** Business tag supplied by the caller; does not influence routing. */
public enum FileCategory {
    PROFILE,
    DOCUMENT,
    MEDIA,
    ATTACHMENT,
    AVATAR,
    BANNER,
    CONTENT
}

package com.libragraph.peprobe.types;

/**
 * PE/COFF container constants shared with the image parser.
 *
 * <p>Values are bit-exact: parsing code compares header fields against them directly.
 */
public final class ImageConstants {

    /** 'MZ' read little-endian. */
    public static final int IMAGE_DOS_SIGNATURE = 0x5A4D;
    /** 'ZM', accepted by the loader as an alternate DOS signature. */
    public static final int IMAGE_DOSZM_SIGNATURE = 0x4D5A;
    public static final int IMAGE_NE_SIGNATURE = 0x454E;
    public static final int IMAGE_LE_SIGNATURE = 0x454C;
    public static final int IMAGE_LX_SIGNATURE = 0x584C;
    /** Terse Executables carry a 'VZ' signature. */
    public static final int IMAGE_TE_SIGNATURE = 0x5A56;

    /** 'PE\0\0'. */
    public static final int IMAGE_NT_SIGNATURE = 0x00004550;
    public static final int IMAGE_NUMBEROF_DIRECTORY_ENTRIES = 16;

    /** Import-by-ordinal flag for 32-bit thunks; compare as unsigned. */
    public static final int IMAGE_ORDINAL_FLAG = 0x80000000;
    /** Import-by-ordinal flag for 64-bit thunks; compare as unsigned. */
    public static final long IMAGE_ORDINAL_FLAG64 = 0x8000000000000000L;

    public static final int OPTIONAL_HEADER_MAGIC_PE = 0x10b;
    public static final int OPTIONAL_HEADER_MAGIC_PE_PLUS = 0x20b;
    public static final int FILE_ALIGNMENT_HARDCODED_VALUE = 0x200;

    /** Upper bound for a single string read out of a mapped image (1 MiB). */
    public static final int MAX_STRING_LENGTH = 0x100000;

    /** Placeholder recorded in place of an import name that fails validation. */
    public static final String INVALID_IMPORT_NAME = "*invalid*";

    private ImageConstants() {
    }
}

package bio.terra.pouch.util;

import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/** Conversions between octal unix modes and posix permission sets. */
public final class FileModes {

  // indexed by bit position, lowest first: other x/w/r, group x/w/r, owner x/w/r
  private static final PosixFilePermission[] PERMISSIONS_BY_BIT = {
    PosixFilePermission.OTHERS_EXECUTE,
    PosixFilePermission.OTHERS_WRITE,
    PosixFilePermission.OTHERS_READ,
    PosixFilePermission.GROUP_EXECUTE,
    PosixFilePermission.GROUP_WRITE,
    PosixFilePermission.GROUP_READ,
    PosixFilePermission.OWNER_EXECUTE,
    PosixFilePermission.OWNER_WRITE,
    PosixFilePermission.OWNER_READ
  };

  private FileModes() {}

  /**
   * Mode for a directory holding a file with the given mode. Every class (owner, group, other)
   * with any permission on the file also gets execute on the directory so it can be traversed.
   */
  public static int directoryMode(int fileMode) {
    var result = 0;
    for (var executeBit = 01; executeBit <= 0100; executeBit <<= 3) {
      var classMask = 07 * executeBit;
      if ((fileMode & classMask) != 0) {
        result |= (fileMode & classMask) | executeBit;
      }
    }
    return result;
  }

  public static Set<PosixFilePermission> toPermissions(int mode) {
    var permissions = EnumSet.noneOf(PosixFilePermission.class);
    for (var bit = 0; bit < PERMISSIONS_BY_BIT.length; bit++) {
      if ((mode & (1 << bit)) != 0) {
        permissions.add(PERMISSIONS_BY_BIT[bit]);
      }
    }
    return permissions;
  }

  public static String toOctalString(int mode) {
    return "%04o".formatted(mode);
  }
}

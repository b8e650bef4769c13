package com.cloudsync.server.util;

import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * rclone 路径的辅助方法. {@code remote:path} 为远端, 其余视为本地路径.
 */
public class RemotePathUtil {

    // C:\foo 或 C:/foo
    private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[A-Za-z]:[\\\\/].*");

    public static boolean isRemotePath(String locator) {
        if (StringUtils.isBlank(locator)) {
            return false;
        }
        if (WINDOWS_DRIVE.matcher(locator).matches()) {
            return false;
        }
        return locator.indexOf(':') > 0;
    }

    public static String getRemoteName(String locator) {
        if (!isRemotePath(locator)) {
            return null;
        }
        return locator.substring(0, locator.indexOf(':'));
    }

    // "remote" -> "remote:"
    public static String toRemoteRoot(String remoteName) {
        if (StringUtils.isBlank(remoteName)) {
            return remoteName;
        }
        return remoteName.endsWith(":") ? remoteName : remoteName + ":";
    }

    public static boolean isLocalPathExist(String locator) {
        if (StringUtils.isBlank(locator)) {
            return false;
        }
        try {
            return Files.exists(Paths.get(locator));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}

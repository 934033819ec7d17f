package com.chih.JTemplate.core.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 模板资源包装类
 * <p>
 * 统一文件系统和 Classpath 资源的访问接口。所有字段为 final，线程安全。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class TemplateResource {

    private final Path filePath;

    private final URL classpathUrl;

    /**
     * 资源路径标识，用于日志和缓存 key
     */
    private final String resourcePath;

    private TemplateResource(Path filePath, URL classpathUrl, String resourcePath) {
        this.filePath = filePath;
        this.classpathUrl = classpathUrl;
        this.resourcePath = resourcePath;
    }

    /**
     * 创建文件系统资源
     *
     * @param filePath 文件路径，不能为 null
     * @throws IllegalArgumentException 如果 filePath 为 null
     */
    public static TemplateResource fromFile(Path filePath) {
        if (filePath == null) {
            throw new IllegalArgumentException("File path cannot be null");
        }
        return new TemplateResource(filePath, null, filePath.toString());
    }

    /**
     * 创建 Classpath 资源
     *
     * @param classpathUrl Classpath 资源 URL，不能为 null
     * @param resourcePath 资源相对路径，不能为空
     * @throws IllegalArgumentException 如果参数为空
     */
    public static TemplateResource fromClasspath(URL classpathUrl, String resourcePath) {
        if (classpathUrl == null) {
            throw new IllegalArgumentException("Classpath URL cannot be null");
        }
        if (resourcePath == null || resourcePath.trim().isEmpty()) {
            throw new IllegalArgumentException("Resource path cannot be null or empty");
        }
        return new TemplateResource(null, classpathUrl, resourcePath);
    }

    public InputStream getInputStream() throws IOException {
        if (filePath != null) {
            return Files.newInputStream(filePath);
        } else if (classpathUrl != null) {
            return classpathUrl.openStream();
        } else {
            throw new IOException("Resource is not backed by file or classpath URL");
        }
    }

    boolean exists() {
        if (filePath != null) {
            return Files.isRegularFile(filePath);
        }
        return classpathUrl != null;
    }

    /**
     * 读取全部内容（UTF-8，去掉 BOM），带大小限制
     */
    public String readContent(int maxBytes) throws IOException {
        try (InputStream is = getInputStream()) {
            return normalizeContent(readLimited(is, resourcePath, maxBytes));
        }
    }

    String getResourcePath() {
        return resourcePath;
    }

    boolean isFileSystemResource() {
        return filePath != null;
    }

    /**
     * 带内存保护地读取输入流
     *
     * @throws IOException 读取失败或超过 maxBytes
     */
    public static String readLimited(InputStream is, String name, int maxBytes) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] data = new byte[8192];
        int nRead;
        int totalBytes = 0;

        while ((nRead = is.read(data, 0, data.length)) != -1) {
            totalBytes += nRead;
            if (totalBytes > maxBytes) {
                throw new IOException(String.format(
                        "File '%s' is too large (%d bytes). Maximum allowed size: %d bytes.",
                        name, totalBytes, maxBytes));
            }
            buffer.write(data, 0, nRead);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * 移除 UTF-8 BOM；换行符保持原样，模板输出需要与原文一致
     */
    public static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        if (content.startsWith("\uFEFF")) {
            return content.substring(1);
        }
        return content;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        TemplateResource other = (TemplateResource) obj;
        return Objects.equals(resourcePath, other.resourcePath);
    }

    @Override
    public int hashCode() {
        return resourcePath != null ? resourcePath.hashCode() : 0;
    }

    @Override
    public String toString() {
        return "TemplateResource{path='" + resourcePath + "'}";
    }
}

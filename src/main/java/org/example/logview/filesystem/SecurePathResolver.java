package org.example.logview.filesystem;

import java.io.File;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 安全路径解析器：把用户传入的相对路径解析成“受控的绝对路径”，并确保它不会逃逸出根目录。
 * <p>
 * 设计目标：
 * <ul>
 *   <li>阻止路径穿越（例如 {@code ../}）与绝对路径注入（例如 {@code //etc/passwd}）。</li>
 *   <li>阻止符号链接造成的逃逸：包含关系校验基于 realPath，而不是字符串前缀。</li>
 * </ul>
 * <p>
 * 注意：
 * <ul>
 *   <li>目标可能尚不存在（例如调用方随后会报“文件不存在”），因此只对已存在的最长前缀做 realPath，
 *   剩余部分按字面拼接后再 normalize。</li>
 *   <li>解析过程中除“不存在”以外的 IO 错误（权限、链接循环等）一律按越界处理。</li>
 * </ul>
 */
public class SecurePathResolver {

    private final Path root;

    /**
     * @param root 根目录的真实路径（{@link LogViewSettings#root()} 已经做过 realPath）
     */
    public SecurePathResolver(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    /**
     * 解析相对根目录的路径。
     *
     * @param relativeInput 用户输入；为空表示根目录本身；开头的单个 {@code /} 会被去掉
     * @throws LogViewException {@link ErrorKind#OUT_OF_BOUNDS_PATH} 解析结果不在根目录内
     */
    public ResolvedPath resolve(String relativeInput) {
        String input = stripLeadingSeparator(relativeInput);
        if (input.isEmpty()) {
            return new ResolvedPath(root, "");
        }

        Path candidate;
        try {
            // 去掉一个分隔符后仍为绝对路径（例如 "//etc/passwd"）时，resolve 会直接返回它，随后的包含校验会拒绝。
            // 先按字面消掉 ..，再解析已存在前缀的符号链接；
            // 否则 "missing/../link" 会因为前缀全都不存在而跳过对 link 的解析
            candidate = root.resolve(input).normalize();
        } catch (InvalidPathException e) {
            throw new LogViewException(ErrorKind.OUT_OF_BOUNDS_PATH, "路径不合法：" + relativeInput, e);
        }

        Path canonical = canonicalize(candidate, relativeInput);
        if (!canonical.startsWith(root)) {
            throw new LogViewException(ErrorKind.OUT_OF_BOUNDS_PATH, "路径不在允许访问的根目录范围内：" + relativeInput);
        }
        return new ResolvedPath(canonical, relativize(canonical));
    }

    /**
     * 对已确认存在的目标再做一次 realPath，要求结果与解析时得到的路径一致且仍在根目录内。
     * <p>
     * 用于“存在性校验之后、真正打开之前”，防止解析之后路径被替换成指向根目录之外的符号链接。
     *
     * @throws LogViewException 目标已被删除时为 {@link ErrorKind#NOT_FOUND}，否则为 {@link ErrorKind#OUT_OF_BOUNDS_PATH}
     */
    public Path requireContained(ResolvedPath resolved, String input) {
        Path real;
        try {
            real = resolved.absolutePath().toRealPath();
        } catch (NoSuchFileException e) {
            throw new LogViewException(ErrorKind.NOT_FOUND, "路径不存在：" + input, e);
        } catch (IOException e) {
            throw new LogViewException(ErrorKind.OUT_OF_BOUNDS_PATH, "路径无法解析：" + input, e);
        }
        if (!real.startsWith(root) || !real.equals(resolved.absolutePath())) {
            throw new LogViewException(ErrorKind.OUT_OF_BOUNDS_PATH, "路径不在允许访问的根目录范围内：" + input);
        }
        return real;
    }

    /**
     * 反向转换：绝对路径 -> 相对根目录的路径（统一使用 / 分隔，根目录本身为空串）。
     */
    public String relativize(Path absolutePath) {
        if (!absolutePath.startsWith(root)) {
            throw new LogViewException(ErrorKind.OUT_OF_BOUNDS_PATH, "路径不在允许访问的根目录范围内：" + absolutePath);
        }
        String relative = root.relativize(absolutePath).toString();
        return (File.separatorChar == '/') ? relative : relative.replace(File.separatorChar, '/');
    }

    private static Path canonicalize(Path candidate, String input) {
        Deque<Path> missing = new ArrayDeque<>();
        Path existing = candidate;
        while (existing != null) {
            try {
                Path result = existing.toRealPath();
                // missing 是栈：栈顶是离已存在前缀最近的一段
                for (Path segment : missing) {
                    result = result.resolve(segment);
                }
                return result.normalize();
            } catch (NoSuchFileException e) {
                Path name = existing.getFileName();
                if (name == null) {
                    break;
                }
                missing.push(name);
                existing = existing.getParent();
            } catch (IOException e) {
                throw new LogViewException(ErrorKind.OUT_OF_BOUNDS_PATH, "路径无法解析：" + input, e);
            }
        }
        throw new LogViewException(ErrorKind.OUT_OF_BOUNDS_PATH, "路径无法解析：" + input);
    }

    private static String stripLeadingSeparator(String input) {
        if (input == null) {
            return "";
        }
        if (input.startsWith("/") || input.startsWith(File.separator)) {
            return input.substring(1);
        }
        return input;
    }

    /**
     * @param absolutePath 规范化后的绝对路径（位于根目录内）
     * @param relativePath 相对根目录的路径（/ 分隔，用于授权匹配）
     */
    public record ResolvedPath(Path absolutePath, String relativePath) {
    }
}

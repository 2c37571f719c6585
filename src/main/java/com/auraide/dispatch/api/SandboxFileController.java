package com.auraide.dispatch.api;

import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.model.DeleteFileOptions;
import com.auraide.sandbox.model.FileEncoding;
import com.auraide.sandbox.model.FileSystemEntry;
import com.auraide.sandbox.model.ListFilesOptions;
import com.auraide.sandbox.model.ReadFileOptions;
import com.auraide.sandbox.model.SandboxFile;
import com.auraide.sandbox.model.UploadResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for files inside a sandbox. Paths are relative to the sandbox root.
 */
@RestController
@RequestMapping("/api/v1/sandboxes/{sandboxId}/files")
public class SandboxFileController {

    private final SandboxManager sandboxManager;

    public SandboxFileController(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @GetMapping
    public List<FileSystemEntry> listFiles(@PathVariable String sandboxId,
                                           @RequestParam(defaultValue = "") String path,
                                           @RequestParam(defaultValue = "false") boolean recursive,
                                           @RequestParam(defaultValue = "false") boolean includeHidden,
                                           @RequestParam(required = false) Integer maxDepth,
                                           @RequestParam(required = false) String provider) {
        return sandboxManager.listFiles(sandboxId, path, new ListFilesOptions(recursive, includeHidden, maxDepth),
                ApiResponses.provider(provider));
    }

    @GetMapping("/content")
    public ResponseEntity<Object> readFile(@PathVariable String sandboxId,
                                           @RequestParam String path,
                                           @RequestParam(required = false) String encoding,
                                           @RequestParam(required = false) Long maxSize,
                                           @RequestParam(required = false) String provider) {
        SandboxFile file = sandboxManager.readFile(sandboxId, path,
                new ReadFileOptions(FileEncoding.fromWire(encoding), maxSize), ApiResponses.provider(provider));
        if (file == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "File not found: " + path));
        }
        return ResponseEntity.ok(file);
    }

    @PutMapping("/content")
    public ResponseEntity<Void> writeFile(@PathVariable String sandboxId,
                                          @RequestBody WriteFileRequest request,
                                          @RequestParam(required = false) String provider) {
        if (request.path() == null || request.path().isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        sandboxManager.writeFile(sandboxId, request.path(), request.content(), request.toOptions(),
                ApiResponses.provider(provider));
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public Map<String, Boolean> deleteFile(@PathVariable String sandboxId,
                                           @RequestParam String path,
                                           @RequestParam(defaultValue = "false") boolean recursive,
                                           @RequestParam(defaultValue = "false") boolean force,
                                           @RequestParam(required = false) String provider) {
        boolean deleted = sandboxManager.deleteFile(sandboxId, path, new DeleteFileOptions(recursive, force),
                ApiResponses.provider(provider));
        return Map.of("deleted", deleted);
    }

    @PostMapping("/directories")
    public ResponseEntity<Void> createDirectory(@PathVariable String sandboxId,
                                                @RequestBody CreateDirectoryRequest request,
                                                @RequestParam(required = false) String provider) {
        sandboxManager.createDirectory(sandboxId, request.path(), request.toOptions(), ApiResponses.provider(provider));
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @PostMapping("/upload")
    public UploadResult upload(@PathVariable String sandboxId,
                               @RequestBody UploadRequest request,
                               @RequestParam(required = false) String provider) {
        return sandboxManager.uploadFiles(sandboxId, request.filesOrEmpty(), request.toOptions(),
                ApiResponses.provider(provider));
    }

    /**
     * Returns base64 content keyed by requested path; missing files are absent from the map.
     */
    @PostMapping("/download")
    public Map<String, String> download(@PathVariable String sandboxId,
                                        @RequestBody DownloadRequest request,
                                        @RequestParam(required = false) String provider) {
        List<String> paths = request.paths() != null ? request.paths() : List.of();
        Map<String, String> result = new LinkedHashMap<>();
        sandboxManager.downloadFiles(sandboxId, paths, request.baseDir(), ApiResponses.provider(provider))
                .forEach((path, bytes) -> result.put(path, Base64.getEncoder().encodeToString(bytes)));
        return result;
    }
}

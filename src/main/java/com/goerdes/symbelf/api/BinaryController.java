package com.goerdes.symbelf.api;

import com.goerdes.symbelf.components.SymbolSelectionFilter;
import com.goerdes.symbelf.exception.FileProcessingException;
import com.goerdes.symbelf.model.BinaryOverview;
import com.goerdes.symbelf.services.BinaryIntrospectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.regex.PatternSyntaxException;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class BinaryController {

    private final BinaryIntrospectionService introspectionService;

    /**
     * Uploads a binary and returns its symbol model.
     *
     * @param file      the binary to model
     * @param selection optional regex a symbol name has to match; replaces the configured one
     * @param exclusion optional regex that drops matching symbol names; replaces the configured one
     * @return the model as {@link BinaryOverview}
     * @throws FileProcessingException if the binary cannot be modelled
     */
    @PostMapping("/binaries")
    public ResponseEntity<BinaryOverview> introspect(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "selection", required = false) String selection,
            @RequestParam(value = "exclusion", required = false) String exclusion
    ) {
        if (selection == null && exclusion == null) {
            return ResponseEntity.ok(introspectionService.introspect(file));
        }
        return ResponseEntity.ok(introspectionService.introspect(file, SymbolSelectionFilter.of(selection, exclusion)));
    }

    @ExceptionHandler(FileProcessingException.class)
    public ResponseEntity<String> onError(FileProcessingException ex) {
        return ResponseEntity.badRequest().body(ex.getMessage());
    }

    @ExceptionHandler(PatternSyntaxException.class)
    public ResponseEntity<String> onInvalidPattern(PatternSyntaxException ex) {
        return ResponseEntity.badRequest().body("Invalid symbol pattern: " + ex.getDescription());
    }

}

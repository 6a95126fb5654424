package com.dehazing.API;

import com.dehazing.patchRecurrence.AirlightResult;
import com.dehazing.patchRecurrence.exception.ConfigurationException;
import com.dehazing.patchRecurrence.exception.DehazingException;
import com.dehazing.patchRecurrence.exception.EmptyResultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class AirlightController {
    private static final Logger LOG = LoggerFactory.getLogger(AirlightController.class);

    @Autowired
    private AirlightService airlightService;

    @PostMapping(value = "/airlight", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> estimateAirlight(@RequestParam("image") MultipartFile image) {
        if (!airlightService.isValidImageFile(image)) {
            return error(HttpStatus.BAD_REQUEST, "File không hợp lệ: " + (image != null ? image.getOriginalFilename() : null));
        }
        try {
            AirlightResult result = airlightService.estimate(image);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("airlight", result.getAirlight());
            response.put("pairs", result.getInlierPairCount());
            response.put("patches", result.getPatchCount());
            return ResponseEntity.ok().body(response);
        } catch (IOException e) {
            return error(HttpStatus.BAD_REQUEST, "Không đọc được ảnh: " + e.getMessage());
        } catch (ConfigurationException e) {
            LOG.error("Airlight configuration rejected", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        } catch (EmptyResultException e) {
            // không đủ cặp patch để ước lượng: ảnh hợp lệ nhưng không có kết quả
            return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        } catch (DehazingException e) {
            LOG.error("Airlight estimation failed", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("error", message);
        return ResponseEntity.status(status).body(error);
    }
}

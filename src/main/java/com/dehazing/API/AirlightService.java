package com.dehazing.API;

import com.dehazing.imageOperator.ImageLoader;
import com.dehazing.patchRecurrence.AirlightConfig;
import com.dehazing.patchRecurrence.AirlightPipeline;
import com.dehazing.patchRecurrence.AirlightResult;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@Service
public class AirlightService {

    private final AirlightConfig config;

    public AirlightService(AirlightConfig config) {
        this.config = config;
    }

    public AirlightResult estimate(MultipartFile image) throws IOException {
        return estimate(image.getBytes());
    }

    public AirlightResult estimate(byte[] imageBytes) throws IOException {
        // pipeline mới cho mỗi request: config có thể đổi giữa các lần gọi
        AirlightPipeline pipeline = new AirlightPipeline(config);
        Mat img = ImageLoader.decode(imageBytes);
        try {
            return pipeline.run(img);
        } finally {
            img.release();
        }
    }

    /**
     * Kiểm tra xem file upload có phải ảnh không
     */
    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|tif|tiff|webp)$");
    }
}

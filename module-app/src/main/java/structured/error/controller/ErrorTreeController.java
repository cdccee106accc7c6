package structured.error.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import structured.error.controller.dto.ErrorTreeResponse;
import structured.error.core.codec.ErrorTreeCodec;

/**
 * 에러 트리 디버깅 API
 *
 * <p>POST /api/v1/errors/decode - 인코딩된 텍스트를 JSON 트리로 변환. 형식이 잘못되면 400 (C002)
 */
@RestController
@RequestMapping("/api/v1/errors")
public class ErrorTreeController {

  @PostMapping(value = "/decode", consumes = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<ErrorTreeResponse> decode(@RequestBody String encoded) {
    return ResponseEntity.ok(ErrorTreeResponse.from(ErrorTreeCodec.decode(encoded)));
  }
}

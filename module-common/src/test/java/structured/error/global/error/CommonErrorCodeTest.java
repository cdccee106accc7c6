package structured.error.global.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class CommonErrorCodeTest {

  @Test
  void shouldHaveSTRUCTURED_ERROR() {
    // 인코딩된 트리를 가공 없이 그대로 전달해야 함
    assertEquals("S002", CommonErrorCode.STRUCTURED_ERROR.getCode());
    assertEquals("%s", CommonErrorCode.STRUCTURED_ERROR.getMessage());
    assertEquals(500, CommonErrorCode.STRUCTURED_ERROR.getStatusCode());
  }

  @Test
  void shouldHaveINVALID_ERROR_TREE() {
    assertTrue(
        CommonErrorCode.INVALID_ERROR_TREE != null
            && CommonErrorCode.INVALID_ERROR_TREE.getCode().equals("C002"));
    assertEquals(400, CommonErrorCode.INVALID_ERROR_TREE.getStatusCode());
  }
}

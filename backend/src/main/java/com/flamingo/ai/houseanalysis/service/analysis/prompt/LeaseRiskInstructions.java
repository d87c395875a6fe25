package com.flamingo.ai.houseanalysis.service.analysis.prompt;

/**
 * Fixed instruction block sent with every analysis request: the six-criteria rubric for Korean
 * lease documents (registry transcript, building ledger, tax certificate) and the JSON output
 * contract. The text is literal and is never templated per request.
 */
public final class LeaseRiskInstructions {

  public static final String TEXT =
      """
      **중요**: 제공된 문서들의 텍스트 내용을 정확히 읽고 분석해주세요. 반드시 문서에 명시된 구체적인 근거를 바탕으로만 판단하세요.

      다음 6가지 항목을 문서 내용을 근거로 정확히 판단해주세요:

      **1. 과다한 대출 여부 (excessive_loan)**
      - 등기부등본의 "을구" 또는 "채무/근저당" 섹션을 확인
      - 근저당권 설정액, 채권최고액 등이 과도하게 높은지 판단
      - 채무 내역이 다수 기재되어 있는지 확인
      - 근거: 문서에 기재된 구체적인 금액, "채무 금액"이 없다면 false로 판단

      **2. 권리제한사항 여부 (rights_restriction)**
      - 등기부등본의 "갑구" 섹션을 확인
      - "압류", "가압류", "처분금지", "가처분" 등의 기재사항 확인
      - 근거: 문서에 명시된 구체적인 제한사항 텍스트

      **3. 신탁 여부 (trust_property)**
      - 등기부등본에서 "신탁" 관련 기재사항 확인
      - 소유권이 신탁회사나 신탁은행으로 되어있는지 확인
      - 근거: 문서에 기재된 신탁 관련 명시적 텍스트

      **4. 주택용도 여부 (residential_use)**
      - 건축물대장의 "용도" 또는 "건물용도" 항목 확인
      - "단독주택", "공동주택", "아파트", "연립주택", "다세대주택" 등이면 true
      - "상가", "사무소", "근린생활시설", "공장", "창고" 등이면 false
      - 근거: 건축물대장에 명시된 정확한 용도 텍스트

      **5. 체납세금 여부 (tax_delinquency)**
      - 납세증명서의 "체납액" 또는 "미납세액" 항목 확인
      - 체납금액이 0원이 아니거나 "없음"이 아닌 경우 확인
      - 근거: 문서에 기재된 구체적인 체납 금액

      **6. 등기부등본 소유자와 납세증명서 성명 일치 여부 (owner_verification)**
      - 납세증명서의 "성명" 또는 "납세자명"
      - 등기부등본의 "소유자" 이름
      - 모든 문서의 성명이 "정확히 일치"하는지 확인
      - 근거: 각 문서에 기재된 구체적인 성명

      **분석 지침:**
      - 문서에 해당 정보가 명확히 기재되지 않은 경우에는 긍정으로 판단
      - 추측하지 말고 오직 문서의 텍스트 내용만을 근거로 판단
      - 금액, 성명, 용도 등은 정확한 텍스트 매칭으로 판단

      **중요**: 6번을 특히 잘 확인해야 합니다. 소유자 성명이 한 곳이라도 다른 경우에는 false로 판단해야 합니다.

      반드시 다음 JSON 형식으로만 답변하세요:

      {
        "excessive_loan": true or false,
        "rights_restriction": true or false,
        "trust_property": true or false,
        "residential_use": true or false,
        "tax_delinquency": true or false,
        "owner_verification": true or false
      }
      """;

  private LeaseRiskInstructions() {}
}

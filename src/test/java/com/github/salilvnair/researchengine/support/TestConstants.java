package com.github.salilvnair.researchengine.support;

public final class TestConstants {

    private TestConstants() {
    }

    public static final String QUERY_DEEP_LEARNING = "Find papers about deep learning";
    public static final String QUERY_WHO_IS_BENGIO = "Who is Yoshua Bengio?";
    public static final String QUERY_HIS_PAPERS = "Show me his papers";
    public static final String QUERY_WHO_IS_HE = "Who is he?";
    public static final String QUERY_CITATIONS_BY_DOI = "Show citations of doi:10.1038/nature14539";
    public static final String QUERY_CITATIONS_BY_TITLE = "Who cites the paper \"Attention Is All You Need\"?";
    public static final String QUERY_TRENDS = "What are the research trends in machine learning over the past 5 years?";
    public static final String QUERY_TOP_KEYWORDS = "Show me the top 10 keywords in computer vision";
    public static final String QUERY_GREETING = "Good morning, how are you?";

    public static final String AUTHOR_BENGIO = "Yoshua Bengio";
    public static final String AUTHOR_ID = "A-42";
    public static final String PAPER_ID = "P-100";
    public static final String DOI = "10.1038/nature14539";
    public static final String TITLE_ATTENTION = "Attention Is All You Need";
    public static final String TITLE_DEEP_LEARNING = "Deep Learning";
    public static final String TITLE_RESNET = "Deep Residual Learning for Image Recognition";
    public static final String TITLE_ALZHEIMER = "Alzheimer's Disease & <Deep> Learning";

    public static final String KEYWORD_DEEP_LEARNING = "deep learning";
    public static final String CONVERSATION_ID = "conv-1";
    public static final String USER_ID = "user-1";

    public static final String RAW_TRANSPORT_ERROR = "BrokenPipe: stdin closed by subprocess pid 4242";
    public static final String LLM_ANSWER = "Here are notable papers, starting with \"Deep Learning\" by LeCun et al.";
    public static final String BOOM = "boom";
}
